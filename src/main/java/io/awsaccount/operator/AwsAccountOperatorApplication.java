package io.awsaccount.operator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the AWS account operator.
 */
@SpringBootApplication
public class AwsAccountOperatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AwsAccountOperatorApplication.class, args);
    }
}
