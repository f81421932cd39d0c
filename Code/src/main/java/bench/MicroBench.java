package bench;

import dict.OrderedDict;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mixed get/add/remove throughput of OrderedDict against java.util.TreeMap.
 *
 * Neither structure is thread-safe, so every operation runs under one exclusive
 * lock per structure. Usage: MicroBench [threads] [seconds] [keyRange] [dict|treemap]
 */
public class MicroBench {

    interface KV {
        void insert(int k);
        void delete(int k);
        Integer get(int k);
        int size();
    }

    static class OrderedDictKV implements KV {
        private final OrderedDict<Integer,Integer> map = new OrderedDict<>();
        private final ReentrantLock lock = new ReentrantLock();
        public void insert(int k) {
            lock.lock();
            try { map.add(k, k); } finally { lock.unlock(); }
        }
        public void delete(int k) {
            lock.lock();
            try { map.remove(k); } finally { lock.unlock(); }
        }
        public Integer get(int k) {
            lock.lock();
            try { return map.find(k).orElse(null); } finally { lock.unlock(); }
        }
        public int size() {
            lock.lock();
            try { return map.sizeStructural(); } finally { lock.unlock(); }
        }
    }

    static class TreeMapKV implements KV {
        private final TreeMap<Integer,Integer> map = new TreeMap<>();
        private final ReentrantLock lock = new ReentrantLock();
        public void insert(int k) {
            lock.lock();
            try { map.putIfAbsent(k, k); } finally { lock.unlock(); }
        }
        public void delete(int k) {
            lock.lock();
            try { map.remove(k); } finally { lock.unlock(); }
        }
        public Integer get(int k) {
            lock.lock();
            try { return map.get(k); } finally { lock.unlock(); }
        }
        public int size() {
            lock.lock();
            try { return map.size(); } finally { lock.unlock(); }
        }
    }

    public static void main(String[] args) throws Exception {
        int threads = (args.length >= 1) ? Integer.parseInt(args[0]) : 1;
        int seconds = (args.length >= 2) ? Integer.parseInt(args[1]) : 3;
        int keyRange = (args.length >= 3) ? Integer.parseInt(args[2]) : 200_000;
        String which = (args.length >= 4) ? args[3] : "dict";

        KV ds = "treemap".equalsIgnoreCase(which) ? new TreeMapKV() : new OrderedDictKV();

        // Preload in random order; sorted preloading would degrade the unbalanced tree to a list
        Random pre = new Random(42);
        for (int i = 0; i < keyRange / 4; i++) ds.insert(pre.nextInt(keyRange));

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch stop = new CountDownLatch(threads);

        final long endAt = System.nanoTime() + TimeUnit.SECONDS.toNanos(seconds);
        final ConcurrentLinkedQueue<Long> counts = new ConcurrentLinkedQueue<>();

        for (int t = 0; t < threads; t++) {
            final long seed = 1000L + t;
            pool.submit(() -> {
                try {
                    Random rnd = new Random(seed);
                    long ops = 0;
                    start.await();
                    while (System.nanoTime() < endAt) {
                        int k = rnd.nextInt(keyRange);
                        int r = rnd.nextInt(100);
                        // 80% gets, 10% inserts, 10% deletes
                        if (r < 80) { ds.get(k); }
                        else if (r < 90) { ds.insert(k); }
                        else { ds.delete(k); }
                        ops++;
                    }
                    counts.add(ops);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    stop.countDown();
                }
            });
        }

        start.countDown();
        stop.await();
        pool.shutdown();

        long totalOps = counts.stream().mapToLong(Long::longValue).sum();
        double mopsPerSec = totalOps / (double)seconds / 1_000_000.0;

        System.out.printf("Structure=%s, Threads=%d, Time=%ds, KeyRange=%d, FinalSize=%d, TotalOps=%d, Throughput=%.2f Mops/s%n",
                which, threads, seconds, keyRange, ds.size(), totalOps, mopsPerSec);
    }
}
