package io.awsaccount.operator.runner;

import io.kubernetes.client.extended.controller.ControllerManager;
import io.kubernetes.client.informer.SharedInformerFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Runner to start the informers and the controller manager.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ControllerRunner implements CommandLineRunner {
    private final SharedInformerFactory informerFactory;
    private final ControllerManager controllerManager;

    @Override
    public void run(String... args) {
        log.info("Starting informer factory and controller manager");

        informerFactory.startAllRegisteredInformers();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Stopping controller manager");
            controllerManager.shutdown();
            informerFactory.stopAllRegisteredInformers();
        }, "controller-shutdown"));
        controllerManager.run();
    }
}
