package App;

import Model.FingerprintCorpus;
import Model.Fingerprinter;
import Model.UnsupportedImageException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

public final class ChatExportImporter {

    public record ImportReport(int messages, int imported, int alreadyPresent, int skipped) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Export(String name, List<ExportMessage> messages) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExportMessage(long id, String type, String photo) {}

    private static final Logger log = LoggerFactory.getLogger(ChatExportImporter.class);
    private static final int PROGRESS_EVERY = 500;

    private final ObjectMapper mapper = new ObjectMapper();
    private final Fingerprinter fingerprinter;
    private final FingerprintCorpus corpus;

    public ChatExportImporter(Fingerprinter fingerprinter, FingerprintCorpus corpus) {
        this.fingerprinter = fingerprinter;
        this.corpus = corpus;
    }

    // chatId is the bot-facing id, which may differ from the id inside the export
    public ImportReport importExport(Path resultJson, long chatId) throws IOException {
        log.info("Starting import from: {}", resultJson);

        Export export;
        try (InputStream in = Files.newInputStream(resultJson)) {
            export = mapper.readValue(in, Export.class);
        }
        List<ExportMessage> messages = export.messages() == null ? List.of() : export.messages();
        String chatTitle = export.name() == null ? "<unknown>" : export.name();
        Path baseDir = resultJson.toAbsolutePath().getParent();

        log.info("Chat '{}' with {} messages.", chatTitle, messages.size());

        int seen = 0, imported = 0, alreadyPresent = 0, skipped = 0;
        for (ExportMessage msg : messages) {
            if (++seen % PROGRESS_EVERY == 0) {
                log.info("{}/{} messages processed", seen, messages.size());
            }
            if (!"message".equals(msg.type()) || msg.photo() == null) continue;

            long fp;
            try {
                fp = fingerprinter.fingerprint(baseDir.resolve(msg.photo()));
            } catch (UnsupportedImageException | InvalidPathException e) {
                // deleted thumbnails and files left out of the export end up here
                log.debug("skipping photo of message {}: {}", msg.id(), e.getMessage());
                skipped++;
                continue;
            }

            if (corpus.insert(chatId, msg.id(), fp, chatTitle)) imported++;
            else alreadyPresent++;
        }

        ImportReport report = new ImportReport(messages.size(), imported, alreadyPresent, skipped);
        log.info("Import complete: {}", report);
        return report;
    }
}
