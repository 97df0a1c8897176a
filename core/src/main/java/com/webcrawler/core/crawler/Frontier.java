package com.webcrawler.core.crawler;

import com.webcrawler.core.model.CrawlState;
import com.webcrawler.core.model.WorkItem;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 깊이 제한 FIFO 작업 큐 (BFS).
 *
 * 종료 감지: take 가 항목을 꺼낼 때 같은 임계구역에서 inFlight 를 올리고, 워커는 자식 push 를
 * 모두 마친 뒤 complete 로 내린다. "큐 비어있음 && inFlight == 0" 은 락 안에서 한 번에 판정하므로
 * 워커가 fetch 를 끝내고 자식을 넣기 직전에 0 으로 보이는 틈이 없다.
 * 폴링/슬립 없이 Condition 으로 대기한다.
 */
public final class Frontier {

    private final int maxDepth;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    // 아래 필드는 모두 lock 보호
    private final ArrayDeque<WorkItem> queue = new ArrayDeque<>();
    private int inFlight = 0;
    private boolean stopped = false;
    private boolean terminated = false; // 한 번 true 면 되돌아가지 않음

    public Frontier(int maxDepth) {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() { return maxDepth; }

    /** 해당 깊이의 작업을 받을 수 있는지(깊이 초과는 오류가 아니라 그 가지의 종료 조건) */
    public boolean accepts(int depth) {
        return depth >= 0 && depth <= maxDepth;
    }

    /**
     * 작업 추가. 깊이 초과이거나 이미 종료/중지된 프론티어면 조용히 버리고 false.
     */
    public boolean push(WorkItem item) {
        Objects.requireNonNull(item, "item");
        if (!accepts(item.depth())) return false;
        lock.lock();
        try {
            if (terminated || stopped) return false;
            queue.addLast(item);
            changed.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 다음 작업을 FIFO 로 꺼낸다. 비어 있으면 다른 워커가 자식을 넣거나 모두 끝날 때까지 대기.
     *
     * @return 작업, 또는 프론티어가 drained/stop 상태면 empty
     */
    public Optional<WorkItem> take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                if (stopped) {
                    terminated = true;
                    return Optional.empty();
                }
                WorkItem next = queue.pollFirst();
                if (next != null) {
                    inFlight++;
                    return Optional.of(next);
                }
                if (inFlight == 0) {
                    terminated = true;
                    changed.signalAll(); // 대기 중인 다른 워커도 깨워서 종료
                    return Optional.empty();
                }
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /** take 로 받은 작업 처리 완료(자식 push 이후에 호출해야 함) */
    public void complete(WorkItem item) {
        Objects.requireNonNull(item, "item");
        lock.lock();
        try {
            if (inFlight <= 0) throw new IllegalStateException("complete() without matching take(): " + item);
            inFlight--;
            if (inFlight == 0) changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** 큐 비어있고 처리 중 0 (또는 stop) */
    public boolean isDrained() {
        lock.lock();
        try {
            return stopped || terminated || (queue.isEmpty() && inFlight == 0);
        } finally {
            lock.unlock();
        }
    }

    public CrawlState state() {
        lock.lock();
        try {
            if (stopped || terminated) return CrawlState.TERMINATED;
            if (!queue.isEmpty()) return CrawlState.RUNNING;
            if (inFlight > 0) return CrawlState.DRAINING;
            return CrawlState.TERMINATED;
        } finally {
            lock.unlock();
        }
    }

    /** 협조적 중지: 대기열은 버리고, 이후 take 는 empty. 처리 중인 작업은 끝까지 간다. */
    public void stop() {
        lock.lock();
        try {
            stopped = true;
            queue.clear();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int inFlight() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }
}
