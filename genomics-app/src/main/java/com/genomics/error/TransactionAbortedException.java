package com.genomics.error;

/**
 * An operation inside a batch failed, so none of the batch was applied.
 * The failing operation's own exception is the cause.
 */
public class TransactionAbortedException extends GenomicsException {

    private final int failedOperation;

    public TransactionAbortedException(int failedOperation, GenomicsException cause) {
        super("Transaction rolled back: operation " + failedOperation + " failed: " + cause.getMessage(), cause);
        this.failedOperation = failedOperation;
    }

    public int getFailedOperation() {
        return failedOperation;
    }

    @Override
    public synchronized GenomicsException getCause() {
        return (GenomicsException) super.getCause();
    }
}
