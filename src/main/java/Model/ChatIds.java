package Model;

public final class ChatIds {

    private static final String GROUP_PREFIX = "100";

    private ChatIds() {}

    /**
     * Strips the {@code -100} prefix of supergroup and channel ids, e.g. {@code -1001234567890 -> 1234567890}.
     * Any other id is returned unchanged.
     */
    public static long toDisplayId(long chatId) {
        if (chatId > -100) return chatId;

        // unsigned so that Long.MIN_VALUE keeps all of its digits
        String digits = Long.toUnsignedString(-chatId);
        if (!digits.startsWith(GROUP_PREFIX)) return chatId;

        String rest = digits.substring(GROUP_PREFIX.length());
        return rest.isEmpty() ? 0L : Long.parseLong(rest);
    }

    public static String messageLink(long chatId, long messageId) {
        return "https://t.me/c/" + toDisplayId(chatId) + "/" + messageId;
    }
}
