package com.darinrandal.chromedata.api;

/**
 * Supplies the ChromeData account credentials. Implementations are owned by
 * the caller and may look the values up lazily.
 */
public interface AccountAuth {

    String getAccountNumber();

    String getAccountSecret();
}
