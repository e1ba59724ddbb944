package App;

import Model.ChatIds;
import Model.CorpusException;
import Model.Classification;
import Model.DuplicateClassifier;
import Model.FingerprintCorpus;
import Model.Fingerprinter;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final String USAGE = """
            usage: dupfinder [-c|--config <file>] <command> [args]

              import <result.json> <chat_id>                 import a chat history export
              classify <chat_id> <message_id> <image> [label] check a new image, remembering it if new
              closest <chat_id> <message_id> <image>         show the closest other image of the chat
            """;

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        Path config = Path.of("config.toml");
        List<String> rest = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if (("-c".equals(args[i]) || "--config".equals(args[i])) && i + 1 < args.length) {
                config = Path.of(args[++i]);
            } else {
                rest.add(args[i]);
            }
        }
        if (rest.isEmpty()) {
            out.print(USAGE);
            return EXIT_USAGE;
        }

        Settings settings;
        try {
            settings = Settings.load(config);
        } catch (SettingsException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_FAILURE;
        }
        applyLogLevel(settings.logLevel());

        log.info("Configuration loaded. Connecting to database...");
        try (FingerprintCorpus corpus = new FingerprintCorpus(
                settings.databaseUrl(), settings.databaseUser(), settings.databasePassword())) {
            log.info("Database connected.");
            Fingerprinter fingerprinter = new Fingerprinter();

            String command = rest.get(0);
            List<String> params = rest.subList(1, rest.size());
            switch (command) {
                case "import":
                    if (params.size() != 2) break;
                    ChatExportImporter.ImportReport report = new ChatExportImporter(fingerprinter, corpus)
                            .importExport(Path.of(params.get(0)), Long.parseLong(params.get(1)));
                    out.printf("imported %d of %d messages (%d already known, %d unreadable)%n",
                            report.imported(), report.messages(), report.alreadyPresent(), report.skipped());
                    return EXIT_OK;
                case "classify":
                    if (params.size() < 3 || params.size() > 4) break;
                    return classify(fingerprinter, corpus, settings, params, false, out);
                case "closest":
                    if (params.size() != 3) break;
                    return classify(fingerprinter, corpus, settings, params, true, out);
                default:
                    out.println("unknown command: " + command);
            }
        } catch (NumberFormatException e) {
            out.println("not a number: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            log.error("I/O error: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (CorpusException e) {
            log.error("Database error: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }

        out.print(USAGE);
        return EXIT_USAGE;
    }

    private static int classify(Fingerprinter fingerprinter, FingerprintCorpus corpus, Settings settings,
                                List<String> params, boolean manual, PrintStream out) throws IOException {
        long chatId = Long.parseLong(params.get(0));
        long messageId = Long.parseLong(params.get(1));
        Path image = Path.of(params.get(2));
        byte[] bytes = Files.readAllBytes(image);

        DuplicateClassifier classifier = new DuplicateClassifier(fingerprinter, corpus, settings.similarityThreshold());
        try {
            Classification result = manual
                    ? classifier.classifyManual(chatId, messageId, bytes)
                    : classifier.classifyNewImage(chatId, messageId,
                            params.size() > 3 ? params.get(3) : image.getFileName().toString(), bytes);
            out.println(describe(chatId, result));
            return EXIT_OK;
        } finally {
            classifier.shutdown();
        }
    }

    static String describe(long chatId, Classification result) {
        if (result instanceof Classification.Duplicate d) {
            return "duplicate image (dst " + d.distance() + ").\n" + ChatIds.messageLink(chatId, d.messageId());
        }
        if (result instanceof Classification.ManualMatch m) {
            return "closest match (dst " + m.distance() + ").\n" + ChatIds.messageLink(chatId, m.messageId());
        }
        if (result instanceof Classification.NewImage) return "new image";
        if (result instanceof Classification.NoCorpus) return "no other images in this chat";
        return "not an image";
    }

    private static void applyLogLevel(String level) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx) {
            ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(level, Level.INFO));
        }
    }
}
