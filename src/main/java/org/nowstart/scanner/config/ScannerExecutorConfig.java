package org.nowstart.scanner.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import org.nowstart.scanner.data.property.ScannerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class ScannerExecutorConfig {

    private final ScannerProperties scannerProperties;

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService scannerExecutor() {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "scanner-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(scannerProperties.workerPoolSize(), threadFactory);
    }
}
