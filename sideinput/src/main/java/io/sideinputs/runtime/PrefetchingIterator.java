package io.sideinputs.runtime;

import com.codahale.metrics.Counter;
import io.sideinputs.error.SideInputReadException;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;

/**
 * Consumer side of a merge: a single-pass iterator over values prefetched by reader threads.
 *
 * <p>{@link #hasNext()} blocks until a value is available or every reader thread has finished. A
 * failure captured by a reader thread is thrown from the {@code hasNext()}/{@code next()} call that
 * would otherwise have returned the following value; after that the iterator is exhausted.
 *
 * <p>Closing the iterator before it is exhausted tells the reader threads to stop.
 */
public class PrefetchingIterator<T> implements Iterator<T>, AutoCloseable {
    private final BlockingQueue<ChannelEntry<T>> channel;
    private final int readerThreads;
    private final Runnable cancel;
    private final Counter itemsCounter;

    private int readersDone = 0;
    private boolean finished;
    private T lookahead;

    PrefetchingIterator(BlockingQueue<ChannelEntry<T>> channel, int readerThreads, Runnable cancel, Counter itemsCounter) {
        this.channel = channel;
        this.readerThreads = readerThreads;
        this.cancel = cancel;
        this.itemsCounter = itemsCounter;
        this.finished = readerThreads == 0;
    }

    @Override
    public boolean hasNext() {
        if (lookahead != null) return true;
        if (finished) return false;
        advance();
        return lookahead != null;
    }

    @Override
    public T next() {
        if (!hasNext()) throw new NoSuchElementException();
        T v = lookahead;
        lookahead = null;
        itemsCounter.inc();
        return v;
    }

    private void advance() {
        while (true) {
            ChannelEntry<T> e;
            try {
                e = channel.take();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                close();
                throw new SideInputReadException("Interrupted while waiting for side input values", ie);
            }
            if (e.isDone()) {
                if (++readersDone == readerThreads) {
                    finished = true;
                    return;
                }
                continue;
            }
            if (e.isFailure()) {
                close();
                throw SideInputReadException.propagate(e.failure());
            }
            lookahead = e.value();
            return;
        }
    }

    @Override
    public void close() {
        finished = true;
        lookahead = null;
        cancel.run();
    }
}
