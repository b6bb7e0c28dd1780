package com.influxlog.service;

import com.influxdb.Cancellable;
import com.influxdb.client.QueryApi;
import com.influxdb.exceptions.InfluxException;
import com.influxdb.query.FluxRecord;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Turns the callback form of {@link QueryApi#query(String, String, java.util.function.BiConsumer,
 * java.util.function.Consumer, Runnable)} into a pull-based stream.
 *
 * <p>Rows are handed over through a bounded queue, so the response is read only as fast as
 * the stream is consumed. Closing the stream before the last row cancels the request. An
 * error reported after some rows were delivered is rethrown once those rows are consumed.
 */
final class FluxRecordStream implements Iterator<FluxRecord> {

    static final int BUFFER_SIZE = 256;

    private static final long OFFER_TIMEOUT_MILLIS = 100;
    private static final Object END = new Object();

    private final BlockingQueue<Object> buffer = new ArrayBlockingQueue<>(BUFFER_SIZE);

    private volatile Cancellable cancellable;
    private volatile boolean closed;

    private FluxRecord nextRecord;
    private boolean finished;

    private FluxRecordStream() {
    }

    static Stream<FluxRecord> open(QueryApi queryApi, String flux, String org) {
        FluxRecordStream records = new FluxRecordStream();
        queryApi.query(flux, org, records::onNext, records::onError, records::onComplete);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(records, Spliterator.ORDERED), false)
                .onClose(records::close);
    }

    private void onNext(Cancellable cancellable, FluxRecord record) {
        this.cancellable = cancellable;
        if (!hand(record)) {
            cancellable.cancel();
        }
    }

    private void onError(Throwable error) {
        hand(new Failure(error));
    }

    private void onComplete() {
        hand(END);
    }

    // blocks the response reader while the buffer is full; gives up once the stream is closed
    private boolean hand(Object element) {
        try {
            while (!closed) {
                if (buffer.offer(element, OFFER_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    @Override
    public boolean hasNext() {
        if (nextRecord != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        Object element = take();
        if (element instanceof FluxRecord record) {
            nextRecord = record;
            return true;
        }
        finished = true;
        if (element instanceof Failure failure) {
            throw failure.rethrow();
        }
        return false;
    }

    @Override
    public FluxRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        FluxRecord record = nextRecord;
        nextRecord = null;
        return record;
    }

    private Object take() {
        try {
            return buffer.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new InfluxException(e);
        }
    }

    void close() {
        boolean drained = finished;
        closed = true;
        finished = true;
        Cancellable request = cancellable;
        if (!drained && request != null && !request.isCancelled()) {
            request.cancel();
        }
        buffer.clear();
    }

    private static final class Failure {

        private final Throwable error;

        private Failure(Throwable error) {
            this.error = error;
        }

        RuntimeException rethrow() {
            if (error instanceof RuntimeException runtime) {
                return runtime;
            }
            return new InfluxException(error);
        }
    }
}
