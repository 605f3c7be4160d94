package com.umitunal.stepflow.queue;

import com.umitunal.stepflow.config.StorageConfig;
import com.umitunal.stepflow.serialization.PayloadCodec;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * RocksDB-backed {@link WorkQueue}. Keys sort by scheduled time, so a scan
 * from the first key visits work in due order and stops at the first unit
 * that is not due yet.
 *
 * Leases are taken inside optimistic transactions; a unit whose version
 * changed between scan and lease is left to whichever worker won.
 *
 * @param <T> the type of payload
 */
public class RocksWorkQueue<T> implements WorkQueue<T> {
    private static final Logger log = LoggerFactory.getLogger(RocksWorkQueue.class);
    private static final int BATCH_FLUSH_SIZE = 1000;

    private final OptimisticTransactionDB transactionDB;
    private final WorkUnitSerializer<T> serializer;
    private final Clock clock;
    private final StorageConfig config;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions scanReadOpts;
    private final Options dbOptions;
    private final Cache blockCache;
    private final Filter bloomFilter;

    public RocksWorkQueue(StorageConfig config, PayloadCodec<T> codec) throws RocksDBException {
        this(config, codec, Clock.systemUTC());
    }

    public RocksWorkQueue(StorageConfig config, PayloadCodec<T> codec, Clock clock) throws RocksDBException {
        this.serializer = new WorkUnitSerializer<>(codec);
        this.clock = clock;
        this.config = config;

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache((long) config.getBlockCacheSizeMB() * 1024 * 1024);
        this.bloomFilter = new BloomFilter(10, false);

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true);

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setTableFormatConfig(tableConfig);

        this.transactionDB = OptimisticTransactionDB.open(dbOptions, config.getDataDirectory());

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites())
                .setDisableWAL(!config.isDurableWrites());

        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);

        // Full scans should not evict hot blocks
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);
    }

    @Override
    public void enqueue(String workId, T payload, long scheduledTime, int maxAttempts) throws RocksDBException {
        WorkUnit<T> unit = new WorkUnit<>(workId, payload, scheduledTime, maxAttempts, clock.millis());
        transactionDB.put(writeOpts, WorkUnit.storageKey(scheduledTime, workId), serializer.serialize(unit));
    }

    @Override
    public QueuedWork<T> acquire(String workerId, long leaseDuration) throws RocksDBException {
        long now = clock.millis();

        try (RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                byte[] key = iter.key();
                WorkUnit<T> unit = serializer.deserialize(iter.value());

                if (!unit.isDue(now)) {
                    break;
                }
                if (!unit.isAcquirable(now)) {
                    continue;
                }
                if (!unit.canRetry()) {
                    unit.markFailed("Maximum attempts exceeded");
                    transactionDB.put(writeOpts, key, serializer.serialize(unit));
                    log.warn("Queued work {} failed after {} attempts", unit.getId(), unit.getCurrentAttempt());
                    continue;
                }

                QueuedWork<T> acquired = tryAtomicAcquire(key, unit, workerId, leaseDuration, now);
                if (acquired != null) {
                    return acquired;
                }
            }
        }

        return null;
    }

    @Override
    public void acknowledge(QueuedWork<T> work) throws RocksDBException {
        transactionDB.delete(writeOpts, WorkUnit.storageKey(work.getScheduledTime(), work.getId()));
    }

    @Override
    public void reject(QueuedWork<T> work, String reason) throws RocksDBException {
        byte[] key = WorkUnit.storageKey(work.getScheduledTime(), work.getId());

        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts);
             ReadOptions readOpts = new ReadOptions()) {
            byte[] value = txn.getForUpdate(readOpts, key, true);
            if (value == null) {
                throw new IllegalStateException("Queued work not found: " + work.getId());
            }

            WorkUnit<T> unit = serializer.deserialize(value);
            if (unit.canRetry()) {
                long delay = config.retryDelayAfter(unit.getCurrentAttempt());
                unit.resetForRetry(reason, clock.millis() + delay);
                txn.delete(key);
                txn.put(WorkUnit.storageKey(unit.getScheduledTime(), unit.getId()), serializer.serialize(unit));
                log.debug("Queued work {} retries in {} ms after attempt {}", unit.getId(), delay, unit.getCurrentAttempt());
            } else {
                unit.markFailed(reason);
                txn.put(key, serializer.serialize(unit));
                log.warn("Queued work {} failed after {} attempts: {}", unit.getId(), unit.getCurrentAttempt(), reason);
            }

            txn.commit();
        }
    }

    @Override
    public long recoverAbandoned() throws RocksDBException {
        long now = clock.millis();
        long recovered = 0;

        try (RocksIterator iter = transactionDB.newIterator();
             WriteBatch batch = new WriteBatch()) {

            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                WorkUnit<T> unit = serializer.deserialize(iter.value());

                if (unit.getState() == QueuedWork.State.LEASED && unit.isLeaseExpired(now)) {
                    unit.markAbandoned();
                    batch.put(iter.key(), serializer.serialize(unit));
                    recovered++;

                    if (batch.count() >= BATCH_FLUSH_SIZE) {
                        transactionDB.write(writeOpts, batch);
                        batch.clear();
                    }
                }
            }

            if (batch.count() > 0) {
                transactionDB.write(writeOpts, batch);
            }
        }

        if (recovered > 0) {
            log.info("Recovered {} abandoned leases", recovered);
        }
        return recovered;
    }

    @Override
    public QueueMetrics getMetrics() throws RocksDBException {
        long total = 0;
        long queued = 0;
        long leased = 0;
        long failed = 0;
        long abandoned = 0;

        try (RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                total++;
                switch (serializer.deserialize(iter.value()).getState()) {
                    case QUEUED -> queued++;
                    case LEASED -> leased++;
                    case FAILED -> failed++;
                    case ABANDONED -> abandoned++;
                }
            }
        }

        return new QueueMetrics(total, queued, leased, failed, abandoned);
    }

    @Override
    public long purgeFailed() throws RocksDBException {
        long purged = 0;

        try (RocksIterator iter = transactionDB.newIterator(scanReadOpts);
             WriteBatch batch = new WriteBatch()) {

            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                if (serializer.deserialize(iter.value()).getState() != QueuedWork.State.FAILED) {
                    continue;
                }
                batch.delete(iter.key());
                purged++;

                if (batch.count() >= BATCH_FLUSH_SIZE) {
                    transactionDB.write(writeOpts, batch);
                    batch.clear();
                }
            }

            if (batch.count() > 0) {
                transactionDB.write(writeOpts, batch);
            }
        }

        if (purged > 0) {
            log.info("Purged {} failed work units", purged);
        }
        return purged;
    }

    @Override
    public void close() {
        scanReadOpts.close();
        txnOpts.close();
        writeOpts.close();
        transactionDB.close();
        dbOptions.close();
        blockCache.close();
        bloomFilter.close();
    }

    private QueuedWork<T> tryAtomicAcquire(byte[] key, WorkUnit<T> scanned, String workerId,
                                           long leaseDuration, long now) {
        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts);
             ReadOptions readOpts = new ReadOptions()) {
            byte[] currentValue = txn.getForUpdate(readOpts, key, true);
            if (currentValue == null) {
                return null;
            }

            WorkUnit<T> current = serializer.deserialize(currentValue);
            if (!current.isAcquirable(now) || current.getVersion() != scanned.getVersion()) {
                return null;
            }

            current.lease(workerId, leaseDuration, now);
            txn.put(key, serializer.serialize(current));
            txn.commit();
            return current;
        } catch (RocksDBException e) {
            log.debug("Lease conflict on {}: {}", scanned.getId(), e.getMessage());
            return null;
        }
    }
}
