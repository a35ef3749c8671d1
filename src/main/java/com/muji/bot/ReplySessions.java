package com.muji.bot;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Режим ответа: оператор → чат, в который уходят его обычные сообщения. */
public class ReplySessions {
    private final Map<Long, ReplyTarget> active = new ConcurrentHashMap<>();

    public void start(long operatorId, ReplyTarget target) { active.put(operatorId, target); }

    public Optional<ReplyTarget> current(long operatorId) { return Optional.ofNullable(active.get(operatorId)); }

    /** false, если оператор и не был в режиме ответа. */
    public boolean cancel(long operatorId) { return active.remove(operatorId) != null; }
}
