package ai.casedoc.compare.logging;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class MdcPropagatingExecutorTest {

    private final ExecutorService pool = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        MDC.clear();
        pool.shutdownNow();
    }

    @Test
    void runsTaskWithSubmitterContext() throws Exception {
        MdcPropagatingExecutor executor = new MdcPropagatingExecutor(pool);
        MDC.put("caseId", "3424");

        String seen = CompletableFuture.supplyAsync(() -> MDC.get("caseId"), executor).get(5, TimeUnit.SECONDS);

        assertThat(seen).isEqualTo("3424");
    }

    @Test
    void restoresWorkerContextAfterTask() throws Exception {
        pool.submit(() -> MDC.put("caseId", "worker-own")).get(5, TimeUnit.SECONDS);
        MdcPropagatingExecutor executor = new MdcPropagatingExecutor(pool);
        MDC.put("caseId", "3424");

        CompletableFuture.runAsync(() -> { }, executor).get(5, TimeUnit.SECONDS);
        String afterwards = pool.submit(() -> MDC.get("caseId")).get(5, TimeUnit.SECONDS);

        assertThat(afterwards).isEqualTo("worker-own");
    }

    @Test
    void clearsContextWhenSubmitterHasNone() throws Exception {
        pool.submit(() -> MDC.put("caseId", "stale")).get(5, TimeUnit.SECONDS);
        MdcPropagatingExecutor executor = new MdcPropagatingExecutor(pool);
        MDC.clear();

        String seen = CompletableFuture.supplyAsync(() -> MDC.get("caseId"), executor).get(5, TimeUnit.SECONDS);

        assertThat(seen).isNull();
    }
}
