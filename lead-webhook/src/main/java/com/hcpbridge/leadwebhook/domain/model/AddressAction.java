package com.hcpbridge.leadwebhook.domain.model;

public enum AddressAction {
    REUSE,
    CREATE_NEW
}
