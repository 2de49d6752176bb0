package org.jagriti.casesearch.domain;

public enum CommissionKind {
    STATE,
    COMMISSION
}
