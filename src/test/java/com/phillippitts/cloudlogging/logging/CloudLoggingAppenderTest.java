package com.phillippitts.cloudlogging.logging;

import com.phillippitts.cloudlogging.exception.LogEncodingException;
import com.phillippitts.cloudlogging.logging.json.JsonEncoder;
import com.phillippitts.cloudlogging.logging.json.OrgJsonEncoder;
import com.phillippitts.cloudlogging.testutil.CapturedStream;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.cloudlogging.testutil.LogEvents.LOGGER;
import static com.phillippitts.cloudlogging.testutil.LogEvents.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class CloudLoggingAppenderTest {

    private CapturedStream output;
    private CloudLoggingAppender appender;

    @BeforeEach
    void setUp() {
        output = new CapturedStream();
        appender = newAppender("my-proj", new OrgJsonEncoder(), false);
    }

    @AfterEach
    void tearDown() {
        appender.getRequest().ifPresent(ignored -> appender.flush());
        appender.stop();
    }

    private CloudLoggingAppender newAppender(String project, JsonEncoder encoder, boolean structured) {
        CloudLoggingAppender created = CloudLoggingAppender.newBuilder()
                .setName("test-cloud-logging")
                .setProject(project)
                .setEncoder(encoder)
                .setStructuredPassthrough(structured)
                .setOut(output.printStream())
                .build();
        created.start();
        return created;
    }

    private JSONObject singleEntry() {
        List<String> lines = output.lines();
        assertThat(lines).hasSize(1);
        return new JSONObject(lines.get(0));
    }

    @Test
    void writesPlainTextOutsideRequest() {
        appender.append(event(Level.INFO, "Test message"));

        assertThat(output.text()).isEqualTo("Test message\n");
        assertThat(appender.getRequest()).isEmpty();
        assertThat(appender.getStats().getPassthroughLines()).isEqualTo(1);
    }

    @Test
    void passthroughDoesNotTouchOtherThreadsRequestLogs() throws Exception {
        RequestLogs other = new RequestLogs("https://x/other", null, null);
        ExecutorService otherThread = Executors.newSingleThreadExecutor();
        try {
            otherThread.submit(() -> appender.setRequest(other)).get(5, TimeUnit.SECONDS);

            appender.append(event(Level.ERROR, "outside"));

            assertThat(output.text()).isEqualTo("outside\n");
            assertThat(other.isEmpty()).isTrue();
            assertThat(other.getSeverity()).isEqualTo(Severity.DEFAULT);
        } finally {
            otherThread.submit(appender::flush).get(5, TimeUnit.SECONDS);
            otherThread.shutdownNow();
        }
    }

    @Test
    void writesStructuredEntryOutsideRequestWhenConfigured() {
        appender.stop();
        appender = newAppender("my-proj", new OrgJsonEncoder(), true);

        appender.append(event(Level.WARN, "structured"));

        JSONObject entry = singleEntry();
        assertThat(entry.getString("severity")).isEqualTo("WARNING");
        assertThat(entry.getString("message")).isEqualTo("structured");
        assertThat(entry.getString("name")).isEqualTo(LOGGER);
        assertThat(entry.getLong("process")).isEqualTo(ProcessHandle.current().pid());
        assertThat(entry.has("time")).isTrue();
    }

    @Test
    void buffersEventsWhileRequestIsActive() {
        appender.setRequest(new RequestLogs("https://x/y", null, null));

        appender.append(event(Level.INFO, "First message"));
        appender.append(event(Level.WARN, "Second message"));

        assertThat(output.text()).isEmpty();
        assertThat(appender.getRequest().orElseThrow().snapshot().lineCount()).isEqualTo(2);
    }

    @Test
    void aggregatesRequestIntoSingleEntry() {
        appender.setRequest(new RequestLogs("https://x/y", null, null));

        appender.append(event(Level.INFO, "a"));
        appender.append(event(Level.INFO, "b"));
        appender.append(event(Level.INFO, "c"));
        appender.flush();

        JSONObject entry = singleEntry();
        assertThat(entry.getString("severity")).isEqualTo("INFO");
        assertThat(entry.getString("url")).isEqualTo("https://x/y");
        assertThat(entry.getString("name")).isEqualTo(LOGGER);
        assertThat(entry.getLong("process")).isEqualTo(ProcessHandle.current().pid());
        assertThat(entry.has(CloudLoggingAppender.TRACE_FIELD)).isFalse();
        assertThat(entry.has(CloudLoggingAppender.SPAN_ID_FIELD)).isFalse();

        String message = entry.getString("message");
        assertThat(message).containsSubsequence("\tINFO\ta", "\tINFO\tb", "\tINFO\tc");
        assertThat(message.split("\n")).hasSize(4);
        assertThat(message).matches("(?s)\n\\d{4}-\\d{2}-\\d{2}T[^\t]+Z\tINFO\ta\n.*");
        assertThat(appender.getStats().getFlushedEntries()).isEqualTo(1);
    }

    @Test
    void reportsHighestSeverityIndependentOfOrder() {
        appender.setRequest(new RequestLogs("https://x/y", null, null));

        appender.append(event(Level.INFO, "info"));
        appender.append(event(Level.ERROR, "error"));
        appender.append(event(Level.DEBUG, "debug"));
        appender.flush();

        assertThat(singleEntry().getString("severity")).isEqualTo("ERROR");
    }

    @Test
    void reportsCriticalForFatalEvents() {
        appender.setRequest(new RequestLogs("https://x/y", null, null));

        appender.append(event(Level.WARN, "warn"));
        appender.append(event(Level.FATAL, "fatal"));
        appender.flush();

        JSONObject entry = singleEntry();
        assertThat(entry.getString("severity")).isEqualTo("CRITICAL");
        assertThat(entry.getString("message")).contains("\tCRITICAL\tfatal");
    }

    @Test
    void addsTraceFieldsFromHeader() {
        TraceContext trace = TraceHeaderParser.parse("105445aa7843bc8bf206b120001000/1;o=1").orElseThrow();
        appender.setRequest(new RequestLogs("https://x/y", trace, null));

        appender.append(event(Level.INFO, "Traced message"));
        appender.flush();

        JSONObject entry = singleEntry();
        assertThat(entry.getString(CloudLoggingAppender.TRACE_FIELD))
                .isEqualTo("projects/my-proj/traces/105445aa7843bc8bf206b120001000");
        assertThat(entry.getString(CloudLoggingAppender.SPAN_ID_FIELD)).isEqualTo("1");
        assertThat(entry.getBoolean(CloudLoggingAppender.TRACE_SAMPLED_FIELD)).isTrue();
    }

    @Test
    void omitsTraceButKeepsSpanWithoutProject() {
        appender.stop();
        appender = newAppender(null, new OrgJsonEncoder(), false);
        appender.setRequest(new RequestLogs("https://x/y", new TraceContext("abc123", "def456", null), null));

        appender.append(event(Level.INFO, "no project"));
        appender.flush();

        JSONObject entry = singleEntry();
        assertThat(entry.has(CloudLoggingAppender.TRACE_FIELD)).isFalse();
        assertThat(entry.getString(CloudLoggingAppender.SPAN_ID_FIELD)).isEqualTo("def456");
        assertThat(entry.has(CloudLoggingAppender.TRACE_SAMPLED_FIELD)).isFalse();
    }

    @Test
    void flushClearsContextAndSecondFlushIsNoop() {
        appender.setRequest(new RequestLogs("https://x/y", null, null));
        appender.append(event(Level.INFO, "once"));

        appender.flush();
        String afterFirst = output.text();
        assertThatCode(appender::flush).doesNotThrowAnyException();

        assertThat(appender.getRequest()).isEmpty();
        assertThat(output.text()).isEqualTo(afterFirst);
        assertThat(output.lines()).hasSize(1);
    }

    @Test
    void flushOutsideRequestWritesNothing() {
        assertThatCode(appender::flush).doesNotThrowAnyException();

        assertThat(output.text()).isEmpty();
    }

    @Test
    void flushOfRequestWithoutEventsWritesNothingButClearsContext() {
        appender.setRequest(new RequestLogs("https://x/y", null, null));

        appender.flush();

        assertThat(output.text()).isEmpty();
        assertThat(appender.getRequest()).isEmpty();
    }

    @Test
    void eventsAfterFlushArePassedThrough() {
        appender.setRequest(new RequestLogs("https://x/y", null, null));
        appender.append(event(Level.INFO, "inside"));
        appender.flush();

        appender.append(event(Level.INFO, "after"));

        List<String> lines = output.lines();
        assertThat(lines).hasSize(2);
        assertThat(lines.get(1)).isEqualTo("after");
    }

    @Test
    void includesStackTraceOfThrownException() {
        appender.setRequest(new RequestLogs("https://x/y", null, null));

        appender.append(event(LOGGER, Level.ERROR, "Unexpected error", new IllegalStateException("boom")));
        appender.flush();

        String message = singleEntry().getString("message");
        assertThat(message).contains("\tERROR\tUnexpected error\njava.lang.IllegalStateException: boom");
        assertThat(message).contains("\tat ");
    }

    @Test
    void usesConfiguredLayoutForMessageText() {
        appender.stop();
        appender = CloudLoggingAppender.newBuilder()
                .setName("layout-test")
                .setLayout(PatternLayout.newBuilder().withPattern("[%c{1}] %m%n").build())
                .setOut(output.printStream())
                .build();
        appender.start();

        appender.append(event(Level.INFO, "with layout"));

        assertThat(output.text()).isEqualTo("[OrderController] with layout\n");
    }

    @Test
    void serializesAttachmentUnderExtra() {
        appender.setRequest(new RequestLogs("https://x/y", null, Map.of("tenant", "acme")));

        appender.append(event(Level.INFO, "with extra"));
        appender.flush();

        JSONObject entry = singleEntry();
        assertThat(entry.getJSONObject("extra").getString("tenant")).isEqualTo("acme");
    }

    @Test
    void fallsBackToDegradedEntryWhenAttachmentCannotBeEncoded() {
        JsonEncoder rejectsExtra = entry -> {
            if (entry.containsKey("extra")) {
                throw new LogEncodingException("cannot serialize attachment");
            }
            return new OrgJsonEncoder().encode(entry);
        };
        appender.stop();
        appender = newAppender("my-proj", rejectsExtra, false);
        appender.setRequest(new RequestLogs("https://x/y", null, new Object()));

        appender.append(event(Level.WARN, "still logged"));
        assertThatCode(appender::flush).doesNotThrowAnyException();

        JSONObject entry = singleEntry();
        assertThat(entry.has("extra")).isFalse();
        assertThat(entry.has(CloudLoggingAppender.ENCODING_ERROR_FIELD)).isTrue();
        assertThat(entry.getString("severity")).isEqualTo("WARNING");
        assertThat(entry.getString("message")).contains("still logged");
        assertThat(appender.getStats().getEncodingFallbacks()).isEqualTo(1);
    }

    @Test
    void fallsBackToPlainTextWhenEncoderAlwaysFails() {
        appender.stop();
        appender = newAppender("my-proj", entry -> {
            throw new IllegalStateException("encoder broken");
        }, false);
        appender.setRequest(new RequestLogs("https://x/y", null, null));

        appender.append(event(Level.INFO, "plain fallback"));
        assertThatCode(appender::flush).doesNotThrowAnyException();

        assertThat(output.text()).contains("\tINFO\tplain fallback");
        assertThat(appender.getRequest()).isEmpty();
    }

    @Test
    void countsWriteFailuresWithoutThrowing() {
        PrintStream broken = new PrintStream(new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("stream closed");
            }
        });
        appender.stop();
        appender = CloudLoggingAppender.newBuilder()
                .setName("broken-sink")
                .setOut(broken)
                .build();
        appender.start();

        assertThatCode(() -> appender.append(event(Level.INFO, "lost"))).doesNotThrowAnyException();

        assertThat(appender.getStats().getWriteErrors()).isEqualTo(1);
    }

    @Test
    void resetWithForeignTokenClearsContextWithoutThrowing() throws Exception {
        ContextToken foreign = CompletableFuture
                .supplyAsync(() -> {
                    ContextToken token = appender.setRequest(new RequestLogs("https://x/foreign", null, null));
                    appender.flush();
                    return token;
                })
                .get(5, TimeUnit.SECONDS);
        appender.setRequest(new RequestLogs("https://x/mine", null, null));

        assertThatCode(() -> appender.resetRequest(foreign)).doesNotThrowAnyException();

        assertThat(appender.getRequest()).isEmpty();
    }

    @Test
    void scopeFlushesAndRestoresOuterRequest() {
        RequestLogs outer = new RequestLogs("https://x/outer", null, null);
        ContextToken outerToken = appender.setRequest(outer);
        appender.append(event(Level.INFO, "outer line"));

        try (RequestScope scope = appender.beginRequest(new RequestLogs("https://x/inner", null, null))) {
            assertThat(appender.getRequest()).containsSame(scope.getRequestLogs());
            appender.append(event(Level.ERROR, "inner line"));
        }

        JSONObject inner = singleEntry();
        assertThat(inner.getString("url")).isEqualTo("https://x/inner");
        assertThat(inner.getString("message")).doesNotContain("outer line");
        assertThat(appender.getRequest()).containsSame(outer);
        assertThat(outer.snapshot().message()).contains("outer line").doesNotContain("inner line");

        appender.flush();
        appender.resetRequest(outerToken);
        assertThat(output.lines()).hasSize(2);
    }

    @Test
    void replacementAppenderAggregatesIntoRequestBoundThroughOriginal() {
        CapturedStream replacementOutput = new CapturedStream();
        CloudLoggingAppender replacement = CloudLoggingAppender.newBuilder()
                .setName("test-cloud-logging")
                .setProject("my-proj")
                .setOut(replacementOutput.printStream())
                .build();
        replacement.start();
        try (RequestScope ignored = appender.beginRequest(new RequestLogs("https://x/reloaded", null, null))) {
            appender.stop();

            replacement.append(event(Level.INFO, "after reload"));
            replacement.append(event(Level.WARN, "still aggregated"));

            assertThat(replacementOutput.text()).isEmpty();
            assertThat(replacement.getRequest()).isPresent();
        } finally {
            replacement.stop();
        }

        JSONObject entry = singleEntry();
        assertThat(entry.getString("url")).isEqualTo("https://x/reloaded");
        assertThat(entry.getString("severity")).isEqualTo("WARNING");
        assertThat(entry.getString("message")).contains("after reload").contains("still aggregated");
    }

    @Test
    void recordAttachmentIsWrittenWithItsComponents() {
        appender.setRequest(new RequestLogs("https://x/y", null, new Tenant("acme", 2)));

        appender.append(event(Level.INFO, "with record"));
        appender.flush();

        JSONObject extra = singleEntry().getJSONObject("extra");
        assertThat(extra.getString("id")).isEqualTo("acme");
        assertThat(extra.getInt("tier")).isEqualTo(2);
    }

    record Tenant(String id, int tier) {}

    @Test
    void scopeCloseIsIdempotent() {
        RequestScope scope = appender.beginRequest(new RequestLogs("https://x/y", null, null));
        appender.append(event(Level.INFO, "line"));

        scope.close();
        scope.close();

        assertThat(output.lines()).hasSize(1);
        assertThat(appender.getRequest()).isEmpty();
    }

    @Test
    void concurrentRequestsNeverShareLines() throws Exception {
        int requests = 8;
        int linesPerRequest = 50;
        ExecutorService pool = Executors.newFixedThreadPool(requests);
        CyclicBarrier start = new CyclicBarrier(requests);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int r = 0; r < requests; r++) {
                String id = "req-" + r;
                futures.add(pool.submit(() -> {
                    try (RequestScope ignored = appender.beginRequest(new RequestLogs("https://x/" + id, null, null))) {
                        start.await(5, TimeUnit.SECONDS);
                        for (int i = 0; i < linesPerRequest; i++) {
                            appender.append(event(Level.INFO, id + " line " + i));
                            Thread.yield();
                        }
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<String> lines = output.lines();
        assertThat(lines).hasSize(requests);
        for (String line : lines) {
            JSONObject entry = new JSONObject(line);
            String id = entry.getString("url").substring("https://x/".length());
            String message = entry.getString("message");
            assertThat(message.split("\n")).hasSize(linesPerRequest + 1);
            for (String messageLine : message.substring(1).split("\n")) {
                assertThat(messageLine).contains("\t" + id + " line ");
            }
        }
    }
}
