package com.aigreentick.services.merchantonboarding.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identifiers of the platform entities created for a merchant, one per saga step.
 * A populated field means the entity exists on the platform and must not be recreated.
 *
 * transferInstrumentId and sweepId are not saga outputs: the first arrives with
 * capability webhooks, the second is created by the verification state machine.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CreationProgress {

    @Column(name = "legal_entity_id", length = 100)
    private String legalEntityId;

    @Column(name = "sole_proprietorship_legal_entity_id", length = 100)
    private String soleProprietorshipLegalEntityId;

    @Column(name = "progress_account_holder_id", length = 100)
    private String accountHolderId;

    @Column(name = "business_line_id", length = 100)
    private String businessLineId;

    @Column(name = "split_configuration_id", length = 100)
    private String splitConfigurationId;

    @Column(name = "balance_account_id", length = 100)
    private String balanceAccountId;

    @Column(name = "store_id", length = 100)
    private String storeId;

    @Column(name = "visa_payment_method_id", length = 100)
    private String visaPaymentMethodId;

    @Column(name = "mastercard_payment_method_id", length = 100)
    private String mastercardPaymentMethodId;

    @Column(name = "transfer_instrument_id", length = 100)
    private String transferInstrumentId;

    @Column(name = "sweep_id", length = 100)
    private String sweepId;

    public CreationProgress copy() {
        return toBuilder().build();
    }

    /**
     * Copies the saga's identifiers from {@code source} into fields that are still empty.
     * Fields already populated are kept, as are transferInstrumentId and sweepId, which the
     * saga never produces.
     */
    public void fillSagaOutputsFrom(CreationProgress source) {
        legalEntityId = firstPresent(legalEntityId, source.legalEntityId);
        soleProprietorshipLegalEntityId = firstPresent(soleProprietorshipLegalEntityId,
                source.soleProprietorshipLegalEntityId);
        accountHolderId = firstPresent(accountHolderId, source.accountHolderId);
        businessLineId = firstPresent(businessLineId, source.businessLineId);
        splitConfigurationId = firstPresent(splitConfigurationId, source.splitConfigurationId);
        balanceAccountId = firstPresent(balanceAccountId, source.balanceAccountId);
        storeId = firstPresent(storeId, source.storeId);
        visaPaymentMethodId = firstPresent(visaPaymentMethodId, source.visaPaymentMethodId);
        mastercardPaymentMethodId = firstPresent(mastercardPaymentMethodId, source.mastercardPaymentMethodId);
    }

    public boolean hasSweep() {
        return isPresent(sweepId);
    }

    public boolean hasTransferInstrument() {
        return isPresent(transferInstrumentId);
    }

    public boolean hasBalanceAccount() {
        return isPresent(balanceAccountId);
    }

    public static boolean isPresent(String id) {
        return id != null && !id.isBlank();
    }

    private static String firstPresent(String current, String candidate) {
        return isPresent(current) ? current : candidate;
    }
}
