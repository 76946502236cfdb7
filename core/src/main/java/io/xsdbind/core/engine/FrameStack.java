package io.xsdbind.core.engine;

import io.xsdbind.core.model.Result;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;

/**
 * Step stream over a tree of element frames. Frames live on an explicit stack, so the Java call
 * depth stays constant however deep the instance is. Errors of every frame pass through in the
 * order they are produced; the value of a child frame goes to its parent and only the root value
 * reaches the stream.
 *
 * @param <T> value type of the stream
 */
final class FrameStack<T> extends StepIterator<T> {

    /** The state of one element in a decode or encode run. */
    interface Frame<T> {

        /**
         * Moves the frame one phase forward, sending its errors to {@code out}.
         *
         * @return a child frame to descend into, or {@code null}
         */
        Frame<T> advance(Consumer<Result<T>> out);

        boolean isDone();

        /** The frame's value, once {@link #isDone()}. */
        T value();

        /** Receives the value of the child frame last returned by {@link #advance}. */
        void childDone(T childValue);
    }

    private final Deque<Frame<T>> stack = new ArrayDeque<>();

    FrameStack(Frame<T> root) {
        stack.push(root);
    }

    @Override
    protected Result<T> computeNext() {
        while (!stack.isEmpty()) {
            Frame<T> top = stack.peek();
            Frame<T> child = top.advance(this::emit);
            if (child != null) {
                stack.push(child);
            } else if (top.isDone()) {
                stack.pop();
                if (stack.isEmpty()) {
                    return Result.value(top.value());
                }
                stack.peek().childDone(top.value());
            }
            if (hasPending()) {
                return null;
            }
        }
        return null;
    }
}
