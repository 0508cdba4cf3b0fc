package com.baskettecase.credvault.credential;

public enum SecretStatus {
    OK,
    NOT_FOUND,
    DECRYPTION_ERROR,
    ERROR
}
