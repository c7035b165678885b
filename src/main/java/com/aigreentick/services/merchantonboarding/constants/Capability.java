package com.aigreentick.services.merchantonboarding.constants;

/**
 * The six account-holder capabilities that must all be verified before payouts are enabled.
 * {@link #getKey()} is the field name in the platform's capability snapshot.
 */
public enum Capability {
    RECEIVE_PAYMENTS("receivePayments"),
    SEND_TO_TRANSFER_INSTRUMENT("sendToTransferInstrument"),
    SEND_TO_BALANCE_ACCOUNT("sendToBalanceAccount"),
    RECEIVE_FROM_BALANCE_ACCOUNT("receiveFromBalanceAccount"),
    RECEIVE_FROM_TRANSFER_INSTRUMENT("receiveFromTransferInstrument"),
    RECEIVE_FROM_PLATFORM_PAYMENTS("receiveFromPlatformPayments");

    public static final String VERIFICATION_VALID = "valid";

    private final String key;

    Capability(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
