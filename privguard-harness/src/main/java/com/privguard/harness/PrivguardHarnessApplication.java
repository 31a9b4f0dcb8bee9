package com.privguard.harness;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Privacy group authorization verification harness.
 *
 * <p>Runs the verification matrix once against the configured Paladin nodes and exits with
 * 0 when clean, 1 on any breach or inconclusive case, 2 when setup failed.</p>
 */
@SpringBootApplication(scanBasePackages = "com.privguard")
public class PrivguardHarnessApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PrivguardHarnessApplication.class, args)));
    }
}
