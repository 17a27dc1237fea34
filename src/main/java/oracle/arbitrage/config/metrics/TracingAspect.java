package oracle.arbitrage.config.metrics;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.reflect.Method;

/**
 * Wraps every RPC client call in an observation, tagged with the network it targets.
 */
@Aspect
@Component
@Slf4j
@RequiredArgsConstructor
public class TracingAspect {

    private final ObservationRegistry observationRegistry;

    @Pointcut("execution(public * oracle.arbitrage.client.*Client.*(..))")
    public void rpcClientMethods() {}

    @Around("rpcClientMethods()")
    public Object traceRpcCalls(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        String methodName = method.getName();
        String className = method.getDeclaringClass().getSimpleName();
        Object[] args = joinPoint.getArgs();
        String network = args.length > 0 && args[0] instanceof String ? (String) args[0] : "unknown";

        Observation observation = Observation.createNotStarted("rpc.client." + className + "." + methodName, observationRegistry)
                .lowCardinalityKeyValue("className", className)
                .lowCardinalityKeyValue("methodName", methodName)
                .lowCardinalityKeyValue("network", network)
                .start();
        try (Observation.Scope scope = observation.openScope()) {
            return joinPoint.proceed();
        } catch (IOException | RuntimeException e) {
            observation.error(e);
            log.debug("RPC call {}.{} on {} failed: {}", className, methodName, network, e.getMessage());
            throw e;
        } finally {
            observation.stop();
        }
    }
}
