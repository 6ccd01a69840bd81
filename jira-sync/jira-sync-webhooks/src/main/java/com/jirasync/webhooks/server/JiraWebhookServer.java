package com.jirasync.webhooks.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jirasync.storage.PersistenceConflictException;
import com.jirasync.webhooks.config.WebhookServerConfig;
import com.jirasync.webhooks.pipeline.SyncResponse;
import com.jirasync.webhooks.pipeline.WebhookPipeline;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Embedded Jetty HTTP server that receives Jira webhook deliveries and runs
 * them through a {@link WebhookPipeline}.
 *
 * <h2>Usage</h2>
 * <pre>
 *   WebhookServerConfig config = WebhookServerConfig.builder()
 *       .port(8080)
 *       .path("/webhooks/jira")
 *       .processingTimeoutMs(5000)
 *       .build();
 *
 *   JiraWebhookServer server = new JiraWebhookServer(config, pipeline);
 *   server.start();
 *   // ... application runs ...
 *   server.stop();
 * </pre>
 *
 * <h2>Status codes</h2>
 * <pre>
 *   ACCEPTED                              -> 200
 *   REJECTED                              -> 400
 *   write conflict, timeout, pool full    -> 503
 *   any other failure                     -> 500
 * </pre>
 * Every response carries a JSON {@link SyncResponse} body.
 */
public class JiraWebhookServer {

    private static final Logger log = LoggerFactory.getLogger(JiraWebhookServer.class);
    private static final String JSON = "application/json";
    private static final int    MIN_JETTY_THREADS = 8;

    private final WebhookServerConfig config;
    private final WebhookPipeline     pipeline;
    private final ObjectMapper        mapper;

    private Server             jettyServer;
    private ServerConnector    connector;
    private ThreadPoolExecutor workers;

    public JiraWebhookServer(WebhookServerConfig config, WebhookPipeline pipeline) {
        this.config   = config;
        this.pipeline = pipeline;
        this.mapper   = new ObjectMapper().registerModule(new JavaTimeModule());
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    public synchronized void start() throws Exception {
        if (jettyServer != null) {
            throw new IllegalStateException("Server already started");
        }
        int threads = config.getMaxThreads();
        workers = new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(threads * 4), new WorkerThreadFactory());

        QueuedThreadPool pool = new QueuedThreadPool(Math.max(threads, MIN_JETTY_THREADS), 2);
        pool.setName("jira-sync-http");
        jettyServer = new Server(pool);

        connector = new ServerConnector(jettyServer, 1, 1);
        connector.setPort(config.getPort());
        jettyServer.addConnector(connector);

        ServletContextHandler ctx = new ServletContextHandler();
        ctx.setContextPath("/");
        ctx.addServlet(new ServletHolder(new WebhookServlet()), config.getPath());
        jettyServer.setHandler(ctx);

        jettyServer.start();
        log.info("Jira webhook server listening on port {} at path {}", getLocalPort(), config.getPath());
    }

    public synchronized void stop() throws Exception {
        if (jettyServer != null) {
            jettyServer.stop();
            jettyServer = null;
            log.info("Jira webhook server stopped");
        }
        if (workers != null) {
            workers.shutdown();
            if (!workers.awaitTermination(config.getProcessingTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Processing workers did not finish in time; interrupting");
                workers.shutdownNow();
            }
            workers = null;
        }
    }

    /** Blocks until the server stops. */
    public void join() throws InterruptedException {
        Server s = jettyServer;
        if (s != null) {
            s.join();
        }
    }

    /** The bound port; differs from the configured one when that was 0. */
    public int getLocalPort() {
        return connector == null ? -1 : connector.getLocalPort();
    }

    // ------------------------------------------------------------------
    // Internal servlet
    // ------------------------------------------------------------------

    private class WebhookServlet extends HttpServlet {

        @Override
        protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            byte[] body = req.getInputStream().readAllBytes();
            String contentType = req.getContentType();

            Future<SyncResponse> future;
            try {
                future = workers.submit(() -> pipeline.handle(body, contentType));
            } catch (RejectedExecutionException e) {
                log.warn("Processing pool saturated; rejecting delivery with 503");
                write(resp, HttpServletResponse.SC_SERVICE_UNAVAILABLE, SyncResponse.failed("Server busy"));
                return;
            }

            try {
                SyncResponse response = future.get(config.getProcessingTimeoutMs(), TimeUnit.MILLISECONDS);
                int status = response.getStatus() == SyncResponse.Status.REJECTED
                        ? HttpServletResponse.SC_BAD_REQUEST
                        : HttpServletResponse.SC_OK;
                write(resp, status, response);
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Processing exceeded {} ms; answering 503", config.getProcessingTimeoutMs());
                write(resp, HttpServletResponse.SC_SERVICE_UNAVAILABLE, SyncResponse.failed("Processing timed out"));
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                write(resp, HttpServletResponse.SC_SERVICE_UNAVAILABLE, SyncResponse.failed("Interrupted"));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof PersistenceConflictException) {
                    write(resp, HttpServletResponse.SC_SERVICE_UNAVAILABLE,
                            SyncResponse.failed("Concurrent update conflict, retry later"));
                } else {
                    log.error("Webhook processing failed", cause);
                    write(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR,
                            SyncResponse.failed("Internal error"));
                }
            }
        }
    }

    private void write(HttpServletResponse resp, int status, SyncResponse body) throws IOException {
        resp.setStatus(status);
        resp.setContentType(JSON);
        resp.setCharacterEncoding("UTF-8");
        resp.getOutputStream().write(mapper.writeValueAsBytes(body));
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "jira-sync-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
