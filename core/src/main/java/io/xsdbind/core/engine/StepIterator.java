package io.xsdbind.core.engine;

import io.xsdbind.core.model.Result;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Forward-only iterator over the steps of a decode or encode stream. Subclasses produce steps in
 * {@link #computeNext()}. Steps queued with {@link #emit} during a call are returned before the
 * step that call returns. A call that returns {@code null} with nothing queued ends the stream.
 *
 * @param <T> value type of the stream
 */
public abstract class StepIterator<T> implements Iterator<Result<T>> {

    private final Deque<Result<T>> pending = new ArrayDeque<>();
    private Result<T> next;
    private boolean ended;

    /** Produces the next step, or {@code null} if it only queued steps or the stream is over. */
    protected abstract Result<T> computeNext();

    /** Queues a step to be returned before the next {@link #computeNext()} call. */
    protected final void emit(Result<T> step) {
        pending.add(step);
    }

    /** Returns {@code true} if steps queued with {@link #emit} are waiting to be returned. */
    protected final boolean hasPending() {
        return !pending.isEmpty();
    }

    @Override
    public final boolean hasNext() {
        if (next != null) {
            return true;
        }
        while (pending.isEmpty() && !ended) {
            Result<T> computed = computeNext();
            if (computed != null) {
                pending.add(computed);
            } else if (pending.isEmpty()) {
                ended = true;
            }
        }
        next = pending.poll();
        return next != null;
    }

    @Override
    public final Result<T> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Result<T> step = next;
        next = null;
        return step;
    }
}
