package com.fintech.invoicevalidation.service;

import com.fintech.invoicevalidation.dto.AccessToken;
import com.fintech.invoicevalidation.exception.AuthenticationException;

/**
 * Source of bearer tokens for the SUNAT validation API.
 */
public interface TokenProvider {

    /**
     * Returns a token that stays valid for at least the configured safety margin.
     *
     * @throws AuthenticationException if no token can be obtained
     */
    AccessToken getToken() throws AuthenticationException;
}
