package com.darinrandal.chromedata.api;

import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;

@NonNullByDefault
public class StaticAccountAuth implements AccountAuth {

    private final String accountNumber;
    private final String accountSecret;

    public StaticAccountAuth(String accountNumber, String accountSecret) {
        this.accountNumber = Objects.requireNonNull(accountNumber, "accountNumber");
        this.accountSecret = Objects.requireNonNull(accountSecret, "accountSecret");
    }

    @Override
    public String getAccountNumber() {
        return accountNumber;
    }

    @Override
    public String getAccountSecret() {
        return accountSecret;
    }

    @Override
    public String toString() {
        return "StaticAccountAuth[" + accountNumber + "]";
    }
}
