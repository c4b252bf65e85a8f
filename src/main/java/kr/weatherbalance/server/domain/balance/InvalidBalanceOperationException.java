package kr.weatherbalance.server.domain.balance;

public class InvalidBalanceOperationException extends RuntimeException {

    public static final String MESSAGE = "Invalid operation specified. Use 'increase' or 'decrease'.";

    private final String operation;

    public InvalidBalanceOperationException(String operation) {
        super(MESSAGE);
        this.operation = operation;
    }

    public static InvalidBalanceOperationException of(String operation) {
        return new InvalidBalanceOperationException(operation);
    }

    public String getOperation() {
        return operation;
    }
}
