package com.aigreentick.services.merchantonboarding.entity;

import com.aigreentick.services.merchantonboarding.constants.Capability;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Arrays;

/**
 * The six capability flags reported by the platform.
 * Each flag only ever moves false → true; there is no setter that clears one.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class VerificationStatuses {

    @Column(name = "receive_payments", nullable = false)
    private boolean receivePayments;

    @Column(name = "send_to_transfer_instrument", nullable = false)
    private boolean sendToTransferInstrument;

    @Column(name = "send_to_balance_account", nullable = false)
    private boolean sendToBalanceAccount;

    @Column(name = "receive_from_balance_account", nullable = false)
    private boolean receiveFromBalanceAccount;

    @Column(name = "receive_from_transfer_instrument", nullable = false)
    private boolean receiveFromTransferInstrument;

    @Column(name = "receive_from_platform_payments", nullable = false)
    private boolean receiveFromPlatformPayments;

    public boolean isVerified(Capability capability) {
        return switch (capability) {
            case RECEIVE_PAYMENTS -> receivePayments;
            case SEND_TO_TRANSFER_INSTRUMENT -> sendToTransferInstrument;
            case SEND_TO_BALANCE_ACCOUNT -> sendToBalanceAccount;
            case RECEIVE_FROM_BALANCE_ACCOUNT -> receiveFromBalanceAccount;
            case RECEIVE_FROM_TRANSFER_INSTRUMENT -> receiveFromTransferInstrument;
            case RECEIVE_FROM_PLATFORM_PAYMENTS -> receiveFromPlatformPayments;
        };
    }

    /**
     * Sets the flag for {@code capability}. Returns true if it was previously false.
     */
    public boolean markVerified(Capability capability) {
        if (isVerified(capability)) return false;
        switch (capability) {
            case RECEIVE_PAYMENTS -> receivePayments = true;
            case SEND_TO_TRANSFER_INSTRUMENT -> sendToTransferInstrument = true;
            case SEND_TO_BALANCE_ACCOUNT -> sendToBalanceAccount = true;
            case RECEIVE_FROM_BALANCE_ACCOUNT -> receiveFromBalanceAccount = true;
            case RECEIVE_FROM_TRANSFER_INSTRUMENT -> receiveFromTransferInstrument = true;
            case RECEIVE_FROM_PLATFORM_PAYMENTS -> receiveFromPlatformPayments = true;
        }
        return true;
    }

    public boolean allVerified() {
        return Arrays.stream(Capability.values()).allMatch(this::isVerified);
    }

    public VerificationStatuses copy() {
        return toBuilder().build();
    }
}
