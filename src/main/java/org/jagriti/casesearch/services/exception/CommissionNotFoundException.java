package org.jagriti.casesearch.services.exception;

import org.jagriti.casesearch.domain.CommissionKind;

import lombok.Getter;

@Getter
public class CommissionNotFoundException extends RuntimeException {

    private final CommissionKind kind;

    public CommissionNotFoundException(final CommissionKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public static CommissionNotFoundException state(final String stateName) {
        return new CommissionNotFoundException(CommissionKind.STATE,
                "State '" + stateName + "' not found");
    }

    public static CommissionNotFoundException stateId(final int stateCommissionId) {
        return new CommissionNotFoundException(CommissionKind.STATE,
                "State with commission ID " + stateCommissionId + " not found");
    }

    public static CommissionNotFoundException commission(final String commissionName, final String stateName) {
        return new CommissionNotFoundException(CommissionKind.COMMISSION,
                "Commission '" + commissionName + "' not found in state '" + stateName + "'");
    }
}
