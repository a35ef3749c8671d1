package com.muji.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.muji.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.LongSupplier;
import java.util.function.Predicate;

/**
 * Хранилище единственного JSON-документа.
 *
 * <ul>
 *   <li>{@link #load()} отдаёт глубокую копию; в пределах TTL читает из кэша без блокировки.</li>
 *   <li>{@link #save(Document)} пишет во временный файл и атомарно переименовывает его поверх
 *   основного, так что читатель никогда не видит недописанный документ.</li>
 *   <li>Писатели сериализуются локом процесса и файловым локом на {@code <file>.lock}; версия на
 *   диске сверяется с версией, которую загрузил вызывающий. При несовпадении {@link StaleDocumentException}.</li>
 * </ul>
 *
 * Файл открывают два процесса (публичный и админский), у каждого свой экземпляр и свой кэш.
 */
public class DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);

    // FileLock принадлежит всей JVM, поэтому внутрипроцессный лок общий для всех экземпляров на один путь
    private static final ConcurrentMap<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();

    private final ObjectMapper om = Json.mapper();
    private final Path file;
    private final Path tmp;
    private final Path lockFile;
    private final long ttlNanos;
    private final LongSupplier ticker;
    private final ReentrantLock lock;

    private volatile Snapshot cache;

    private record Snapshot(byte[] json, long takenAt) {}

    public DocumentStore(Path file, Duration ttl) {
        this(file, ttl, System::nanoTime);
    }

    DocumentStore(Path file, Duration ttl, LongSupplier ticker) {
        this.file = file.toAbsolutePath().normalize();
        this.tmp = sibling(".tmp");
        this.lockFile = sibling(".lock");
        this.ttlNanos = ttl.toNanos();
        this.ticker = ticker;
        this.lock = LOCKS.computeIfAbsent(this.file, p -> new ReentrantLock());
    }

    public Path file() { return file; }

    /** Текущий документ; вызывающий может свободно его менять. */
    public Document load() {
        Snapshot s = fresh();
        if (s == null) {
            lock.lock();
            try {
                s = fresh();
                if (s == null) {
                    s = new Snapshot(readDisk(), ticker.getAsLong());
                    cache = s;
                }
            } finally {
                lock.unlock();
            }
        }
        return parse(s.json());
    }

    /**
     * Сохраняет документ, если с момента его загрузки файл никто не перезаписал.
     * При успехе версия документа увеличивается на единицу.
     *
     * @throws StaleDocumentException версия на диске отличается от {@code doc.version}
     * @throws UncheckedIOException   запись не удалась; предыдущий файл остаётся на месте
     */
    public void save(Document doc) {
        lock.lock();
        try {
            createParent();
            try (FileChannel ch = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = ch.lock()) {
                long onDisk = diskVersion();
                if (onDisk != doc.version) throw new StaleDocumentException(doc.version, onDisk);

                long previous = doc.version;
                doc.version = previous + 1;
                try {
                    byte[] json = om.writeValueAsBytes(doc);
                    writeAtomically(json);
                    cache = new Snapshot(json, ticker.getAsLong());
                } catch (IOException | RuntimeException e) {
                    doc.version = previous;
                    throw e;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save " + file, e);
        } finally {
            lock.unlock();
        }
    }

    /** load → mutation → save; результат мутации возвращается вызывающему. */
    public <T> T update(Function<Document, T> mutation) {
        return updateIf(mutation, r -> true);
    }

    /**
     * Как {@link #update}, но документ сохраняется, только если {@code shouldSave} принял результат.
     * Устаревшая запись повторяется один раз на свежем документе с диска; после второй неудачи летит
     * {@link DocumentConflictException}. Исключение из мутации прерывает цикл без сохранения.
     */
    public <T> T updateIf(Function<Document, T> mutation, Predicate<? super T> shouldSave) {
        lock.lock();
        try {
            for (int attempt = 1; ; attempt++) {
                Document doc = load();
                T result = mutation.apply(doc);
                if (!shouldSave.test(result)) return result;
                try {
                    save(doc);
                    return result;
                } catch (StaleDocumentException e) {
                    invalidate();
                    if (attempt >= 2) throw new DocumentConflictException(e);
                    log.info("Stale write to {} (v{} vs v{}), retrying on fresh copy",
                            file.getFileName(), e.expectedVersion(), e.actualVersion());
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /** Следующий load пойдёт на диск. */
    public void invalidate() {
        cache = null;
    }

    /* ===================== внутреннее ===================== */

    private Snapshot fresh() {
        Snapshot s = cache;
        if (s != null && ticker.getAsLong() - s.takenAt() < ttlNanos) return s;
        return null;
    }

    private byte[] readDisk() {
        try {
            if (!Files.exists(file)) {
                return om.writeValueAsBytes(Document.empty());
            }
            byte[] bytes = Files.readAllBytes(file);
            Document doc;
            try {
                doc = om.readValue(bytes, Document.class);
            } catch (JsonProcessingException e) {
                log.error("Data file {} looks corrupt: {}", file, e.getOriginalMessage());
                doc = recoverCorrupt();
            }
            if (doc == null) doc = Document.empty();
            return om.writeValueAsBytes(doc.backfill());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private Document parse(byte[] json) {
        try {
            return om.readValue(json, Document.class).backfill();
        } catch (IOException e) {
            throw new UncheckedIOException("Cached document is unreadable", e);
        }
    }

    /** Версия файла на диске; отсутствующий или битый файл имеет версию 0. */
    private long diskVersion() throws IOException {
        if (!Files.exists(file)) return 0;
        try {
            return om.readTree(Files.readAllBytes(file)).path("version").asLong(0);
        } catch (JsonProcessingException e) {
            log.warn("Data file {} is unparseable, treating it as version 0", file);
            return 0;
        } catch (NoSuchFileException e) {
            return 0;
        }
    }

    /**
     * Повторное чтение под межпроцессным локом: битый файл уносится в сторону, чтобы следующее
     * сохранение не стёрло его содержимое. Если другой процесс успел записать целый файл, он
     * возвращается как есть.
     */
    Document recoverCorrupt() throws IOException {
        lock.lock();
        try {
            createParent();
            try (FileChannel ch = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = ch.lock()) {
                byte[] bytes;
                try {
                    bytes = Files.readAllBytes(file);
                } catch (NoSuchFileException e) {
                    log.info("Corrupt data file {} was already moved by another process", file);
                    return Document.empty();
                }
                try {
                    Document doc = om.readValue(bytes, Document.class);
                    log.info("Data file {} was rewritten by another process, keeping it", file);
                    return doc == null ? Document.empty() : doc;
                } catch (JsonProcessingException e) {
                    Path aside = sibling(".corrupt-" + System.currentTimeMillis());
                    Files.move(file, aside);
                    log.warn("Corrupt data file moved to {}, starting from an empty document", aside);
                    return Document.empty();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void writeAtomically(byte[] json) throws IOException {
        try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buf = ByteBuffer.wrap(json);
            while (buf.hasRemaining()) ch.write(buf);
            ch.force(true);
        }
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void createParent() throws IOException {
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    private Path sibling(String suffix) {
        return file.resolveSibling(file.getFileName() + suffix);
    }
}
