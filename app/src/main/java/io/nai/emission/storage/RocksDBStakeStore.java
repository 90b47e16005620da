package io.nai.emission.storage;

import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.NodeId;
import io.nai.emission.state.DelegatorStakeRecord;
import io.nai.emission.state.StakeRecordCodec;
import io.nai.emission.state.StakeStore;
import io.nai.emission.state.ValidatorStakeRecord;
import org.rocksdb.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent StakeStore using RocksDB.
 *
 * Layout (column families):
 *  - "validators"  : key = nodeId(20),                val = validator stake record
 *  - "delegations" : key = nodeId(20) || address(33), val = delegation record
 */
public final class RocksDBStakeStore implements StakeStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(RocksDBStakeStore.class.getName());

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final ColumnFamilyHandle cfValidators;
    private final ColumnFamilyHandle cfDelegations;
    private final List<ColumnFamilyHandle> handles;
    private final DBOptions dbOptions;

    private RocksDBStakeStore(RocksDB db,
                              ColumnFamilyHandle cfValidators,
                              ColumnFamilyHandle cfDelegations,
                              List<ColumnFamilyHandle> handles,
                              DBOptions dbOptions) {
        this.db = db;
        this.cfValidators = cfValidators;
        this.cfDelegations = cfDelegations;
        this.handles = handles;
        this.dbOptions = dbOptions;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBStakeStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                new ColumnFamilyDescriptor("validators".getBytes()),
                new ColumnFamilyDescriptor("delegations".getBytes())
        );
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
        try {
            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            LOG.info(() -> "Opened stake store at " + dataDir);
            return new RocksDBStakeStore(db, cfHandles.get(1), cfHandles.get(2), cfHandles, dbOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    @Override
    public synchronized Optional<ValidatorStakeRecord> getValidatorStake(NodeId nodeId) {
        try {
            byte[] value = db.get(cfValidators, nodeId.bytes());
            return value == null ? Optional.empty() : Optional.of(StakeRecordCodec.decodeValidator(value));
        } catch (RocksDBException e) {
            throw new IllegalStateException("getValidatorStake failed", e);
        }
    }

    @Override
    public synchronized void putValidatorStake(ValidatorStakeRecord record) {
        try {
            db.put(cfValidators, record.nodeId().bytes(), StakeRecordCodec.encode(record));
        } catch (RocksDBException e) {
            throw new IllegalStateException("putValidatorStake failed", e);
        }
    }

    @Override
    public synchronized boolean removeValidatorStake(NodeId nodeId) {
        try {
            byte[] key = nodeId.bytes();
            if (db.get(cfValidators, key) == null) {
                return false;
            }
            db.delete(cfValidators, key);
            return true;
        } catch (RocksDBException e) {
            throw new IllegalStateException("removeValidatorStake failed", e);
        }
    }

    @Override
    public synchronized Optional<DelegatorStakeRecord> getDelegatorStake(Address delegator, NodeId nodeId) {
        try {
            byte[] value = db.get(cfDelegations, StakeRecordCodec.delegationKey(nodeId, delegator));
            return value == null ? Optional.empty() : Optional.of(StakeRecordCodec.decodeDelegation(value));
        } catch (RocksDBException e) {
            throw new IllegalStateException("getDelegatorStake failed", e);
        }
    }

    @Override
    public synchronized void putDelegatorStake(DelegatorStakeRecord record) {
        try {
            db.put(cfDelegations, StakeRecordCodec.delegationKey(record.nodeId(), record.delegator()),
                    StakeRecordCodec.encode(record));
        } catch (RocksDBException e) {
            throw new IllegalStateException("putDelegatorStake failed", e);
        }
    }

    @Override
    public synchronized boolean removeDelegatorStake(Address delegator, NodeId nodeId) {
        byte[] key = StakeRecordCodec.delegationKey(nodeId, delegator);
        try {
            if (db.get(cfDelegations, key) == null) {
                return false;
            }
            db.delete(cfDelegations, key);
            return true;
        } catch (RocksDBException e) {
            throw new IllegalStateException("removeDelegatorStake failed", e);
        }
    }

    @Override
    public synchronized List<ValidatorStakeRecord> validatorStakes() {
        List<ValidatorStakeRecord> out = new ArrayList<>();
        try (RocksIterator it = db.newIterator(cfValidators)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                out.add(StakeRecordCodec.decodeValidator(it.value()));
            }
        }
        return out;
    }

    @Override
    public synchronized List<DelegatorStakeRecord> delegations() {
        List<DelegatorStakeRecord> out = new ArrayList<>();
        try (RocksIterator it = db.newIterator(cfDelegations)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                out.add(StakeRecordCodec.decodeDelegation(it.value()));
            }
        }
        return out;
    }

    @Override
    public synchronized List<DelegatorStakeRecord> delegationsTo(NodeId nodeId) {
        byte[] prefix = nodeId.bytes();
        List<DelegatorStakeRecord> out = new ArrayList<>();
        try (RocksIterator it = db.newIterator(cfDelegations)) {
            for (it.seek(prefix); it.isValid(); it.next()) {
                byte[] key = it.key();
                if (!hasPrefix(key, prefix)) {
                    break;
                }
                out.add(StakeRecordCodec.decodeDelegation(it.value()));
            }
        }
        return out;
    }

    @Override
    public synchronized void close() {
        // handles before the DB, options last
        for (ColumnFamilyHandle handle : handles) {
            closeQuietly(handle, "column family");
        }
        closeQuietly(db, "database");
        closeQuietly(dbOptions, "options");
    }

    private static void closeQuietly(AutoCloseable resource, String what) {
        try {
            resource.close();
        } catch (Exception e) {
            LOG.log(Level.FINE, "Failed to close RocksDB " + what, e);
        }
    }

    private static boolean hasPrefix(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        return Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }
}
