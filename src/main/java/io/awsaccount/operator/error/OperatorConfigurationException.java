package io.awsaccount.operator.error;

public class OperatorConfigurationException extends RuntimeException {

    public OperatorConfigurationException(String message) {
        super(message);
    }

    public OperatorConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
