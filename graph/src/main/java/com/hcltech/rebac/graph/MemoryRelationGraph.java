package com.hcltech.rebac.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory {@link RelationGraph}. One {@link TupleStore} behind a readers-writer lock: grant and
 * revoke take the write lock, every query takes the read lock and may run alongside other queries.
 * <p>
 * Mutations are O(1) and never traverse while holding the write lock. Nothing here acquires the
 * write lock while holding the read lock. Locks are taken uninterruptibly so a mutation, once
 * started, always completes.
 */
public final class MemoryRelationGraph implements RelationGraph {
    private static final Logger log = LoggerFactory.getLogger(MemoryRelationGraph.class);

    private final TupleStore store = new TupleStore();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public boolean grant(Node src, PermissionSet dst) {
        checked(src, dst);
        boolean added = write(() -> store.grant(src, dst));
        log.debug("grant {} -> {} added={}", src, dst, added);
        return added;
    }

    @Override
    public boolean revoke(Node src, PermissionSet dst) {
        checked(src, dst);
        boolean removed = write(() -> store.revoke(src, dst));
        log.debug("revoke {} -> {} removed={}", src, dst, removed);
        return removed;
    }

    @Override
    public boolean exists(Node src, PermissionSet dst) {
        checked(src, dst);
        return read(() -> store.exists(src, dst));
    }

    @Override
    public boolean isPermitted(Node src, PermissionSet dst) {
        return isPermitted(src, dst, Reachability.UNLIMITED);
    }

    @Override
    public boolean isPermitted(Node src, PermissionSet dst, int maxDepth) {
        checked(src, dst);
        boolean permitted = read(() -> Reachability.isPermitted(store, src, dst, maxDepth));
        log.debug("isPermitted {} -> {} maxDepth={} permitted={}", src, dst, maxDepth, permitted);
        return permitted;
    }

    @Override
    public List<ExpandResult> expand(PermissionSet dst) {
        Objects.requireNonNull(dst, "dst");
        NodeValidation.requireValid(dst);
        List<ExpandResult> expanded = read(() -> Expansion.expand(store, dst));
        log.debug("expand {} found {} entities", dst, expanded.size());
        return expanded;
    }

    @Override
    public int edgeCount() {
        return read(store::edgeCount);
    }

    @Override
    public int nodeCount() {
        return read(store::nodeCount);
    }

    private static void checked(Node src, PermissionSet dst) {
        Objects.requireNonNull(src, "src");
        Objects.requireNonNull(dst, "dst");
        NodeValidation.requireValid(src, dst);
    }

    private <T> T read(Supplier<T> body) {
        return locked(lock.readLock(), body);
    }

    private <T> T write(Supplier<T> body) {
        return locked(lock.writeLock(), body);
    }

    private static <T> T locked(Lock l, Supplier<T> body) {
        l.lock();
        try {
            return body.get();
        } finally {
            l.unlock();
        }
    }
}
