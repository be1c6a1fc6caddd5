package com.smartroute.core.execution;

import java.time.Duration;

/**
 * Splits content between a local and a remote backend. The split falls on the
 * line boundary closest to {@code localShare} of the content length; the
 * leading part runs locally, the rest remotely. Outputs are concatenated and
 * quality is weighted by the length of each part. Content without a usable
 * line boundary runs entirely on the local backend.
 */
public class HybridBackend implements ExecutionBackend {

    private final ExecutionBackend local;
    private final ExecutionBackend remote;
    private final double localShare;

    public HybridBackend(ExecutionBackend local, ExecutionBackend remote, double localShare) {
        if (localShare <= 0 || localShare >= 1) {
            throw new IllegalArgumentException("localShare must be in (0,1): " + localShare);
        }
        this.local = local;
        this.remote = remote;
        this.localShare = localShare;
    }

    @Override
    public BackendResponse execute(String content, String taskType, Duration timeout)
            throws ExecutionBackendException {
        int split = splitPoint(content, localShare);
        String head = content.substring(0, split);
        String tail = content.substring(split);

        long start = System.nanoTime();
        BackendResponse first = local.execute(head, taskType, timeout);
        if (tail.isEmpty()) {
            return first;
        }
        Duration left = timeout.minusNanos(System.nanoTime() - start);
        if (left.isNegative() || left.isZero()) {
            throw new ExecutionTimeoutException(name(), timeout);
        }
        BackendResponse second = remote.execute(tail, taskType, left);

        double quality = (first.qualityScore() * head.length() + second.qualityScore() * tail.length())
                / content.length();
        return new BackendResponse(first.output() + "\n" + second.output(), quality);
    }

    @Override
    public String name() {
        return "hybrid(" + local.name() + "+" + remote.name() + ")";
    }

    /**
     * Index just after the newline closest to {@code share * length}, or the
     * full length when the content has no interior newline.
     */
    static int splitPoint(String content, double share) {
        int target = (int) Math.round(content.length() * share);
        int best = content.length();
        int bestDistance = Integer.MAX_VALUE;
        for (int i = content.indexOf('\n'); i >= 0; i = content.indexOf('\n', i + 1)) {
            int candidate = i + 1;
            if (candidate >= content.length()) {
                break;
            }
            int distance = Math.abs(candidate - target);
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best;
    }
}
