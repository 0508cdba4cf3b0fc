package com.baskettecase.credvault.connection;

public enum ConnectionStatus {
    CONNECTED,
    DISCONNECTED
}
