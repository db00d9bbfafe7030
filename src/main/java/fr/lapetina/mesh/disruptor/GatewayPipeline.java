package fr.lapetina.mesh.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.mesh.disruptor.exception.BackpressureException;
import fr.lapetina.mesh.disruptor.handlers.AuthorizationHandler;
import fr.lapetina.mesh.disruptor.handlers.CompletionHandler;
import fr.lapetina.mesh.disruptor.handlers.DispatchHandler;
import fr.lapetina.mesh.disruptor.handlers.RouteResolutionHandler;
import fr.lapetina.mesh.domain.event.GatewayRequestEvent;
import fr.lapetina.mesh.domain.event.GatewayRequestEventFactory;
import fr.lapetina.mesh.domain.model.GatewayRequest;
import fr.lapetina.mesh.domain.model.GatewayResponse;
import fr.lapetina.mesh.gateway.ApiGateway;
import fr.lapetina.mesh.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Disruptor pipeline carrying inbound gateway requests.
 *
 * Requests come from many HTTP worker threads, hence a MULTI producer ring.
 * A full ring rejects the request at once with {@link BackpressureException}
 * instead of queueing it without bound.
 *
 * Stages run in sequence:
 * route resolution, then service auth and cache lookup, then dispatch, then completion.
 * Dispatch only starts the backend call; its response completes the caller's
 * future from the dispatcher callback.
 */
public final class GatewayPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayPipeline.class);

    private final Disruptor<GatewayRequestEvent> disruptor;
    private final RingBuffer<GatewayRequestEvent> ringBuffer;
    private final MetricsRegistry metricsRegistry;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private GatewayPipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;

        this.disruptor = new Disruptor<>(
                new GatewayRequestEventFactory(),
                builder.ringBufferSize,
                new DisruptorThreadFactory("gateway-pipeline"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        disruptor
                .handleEventsWith(new RouteResolutionHandler(builder.gateway))
                .then(new AuthorizationHandler(builder.gateway))
                .then(new DispatchHandler(builder.gateway))
                .then(new CompletionHandler(builder.gateway));

        disruptor.setDefaultExceptionHandler(new PipelineExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("GatewayPipeline created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("GatewayPipeline started");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Submits a request for processing.
     *
     * @return Future completing with the gateway response; it does not fail for request errors
     * @throws BackpressureException if the ring buffer is full or the pipeline is stopped
     */
    public CompletableFuture<GatewayResponse> submit(GatewayRequest request) {
        if (!running.get()) {
            throw new BackpressureException(BackpressureException.BackpressureReason.PIPELINE_STOPPED);
        }

        CompletableFuture<GatewayResponse> responseFuture = new CompletableFuture<>();

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        try {
            GatewayRequestEvent event = ringBuffer.get(sequence);
            event.initialize(request, responseFuture);
        } finally {
            ringBuffer.publish(sequence);
        }

        if (metricsRegistry != null) {
            metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());
        }
        log.debug("Request submitted: requestId={}, method={}, path={}, sequence={}",
                request.requestId(), request.method(), request.path(), sequence);

        return responseFuture;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /**
     * Gracefully shuts down the pipeline.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down GatewayPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("GatewayPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("GatewayPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class DisruptorThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DisruptorThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Completes the caller's future with an error response when a handler throws.
     */
    private static class PipelineExceptionHandler implements ExceptionHandler<GatewayRequestEvent> {

        private static final Logger log = LoggerFactory.getLogger(PipelineExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, GatewayRequestEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);
            event.markFailed(ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private ApiGateway gateway;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder gateway(ApiGateway gateway) {
            this.gateway = gateway;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public GatewayPipeline build() {
            if (gateway == null) {
                throw new IllegalStateException("ApiGateway is required");
            }
            return new GatewayPipeline(this);
        }
    }
}
