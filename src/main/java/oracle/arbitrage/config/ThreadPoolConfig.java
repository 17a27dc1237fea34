package oracle.arbitrage.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ThreadPoolConfig {

    // web3j calls block, so they get their own bounded pool
    @Bean(name = "priceFeedExecutor", destroyMethod = "shutdownNow")
    public ExecutorService priceFeedExecutor(OracleProperties props) {
        return Executors.newFixedThreadPool(props.getReaderThreads());
    }

    @Bean
    public Scheduler priceFeedScheduler(ExecutorService priceFeedExecutor) {
        return Schedulers.fromExecutorService(priceFeedExecutor, "price-feed");
    }
}
