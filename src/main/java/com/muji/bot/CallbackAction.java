package com.muji.bot;

import java.util.Optional;

/**
 * callback_data инлайн-кнопок: {@code reply_<pid>_<uid>}, {@code payment_<pid>_<uid>},
 * {@code list_chats}. У старых уведомлений uid может отсутствовать.
 */
public final class CallbackAction {
    public enum Type { REPLY, PAYMENT, LIST_CHATS }

    static final String LIST_CHATS = "list_chats";

    private final Type type;
    private final ReplyTarget target;

    private CallbackAction(Type type, ReplyTarget target) {
        this.type = type;
        this.target = target;
    }

    public static CallbackAction reply(ReplyTarget t)   { return new CallbackAction(Type.REPLY, t); }
    public static CallbackAction payment(ReplyTarget t) { return new CallbackAction(Type.PAYMENT, t); }
    public static CallbackAction listChats()            { return new CallbackAction(Type.LIST_CHATS, null); }

    public Type type() { return type; }

    /** null для LIST_CHATS */
    public ReplyTarget target() { return target; }

    public static Optional<CallbackAction> parse(String data) {
        if (data == null) return Optional.empty();
        if (LIST_CHATS.equals(data)) return Optional.of(listChats());

        String[] parts = data.split("_", 3);
        if (parts.length < 2) return Optional.empty();
        long profileId;
        try {
            profileId = Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        String userId = parts.length > 2 && !parts[2].isBlank() ? parts[2] : null;
        ReplyTarget t = new ReplyTarget(profileId, userId);
        return switch (parts[0]) {
            case "reply" -> Optional.of(reply(t));
            case "payment" -> Optional.of(payment(t));
            default -> Optional.empty();
        };
    }

    public String data() {
        if (type == Type.LIST_CHATS) return LIST_CHATS;
        String prefix = type == Type.REPLY ? "reply_" : "payment_";
        String data = prefix + target.profileId();
        return target.userId() == null ? data : data + "_" + target.userId();
    }
}
