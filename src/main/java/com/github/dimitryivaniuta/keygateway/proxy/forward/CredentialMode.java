package com.github.dimitryivaniuta.keygateway.proxy.forward;

/** Where the admitted key is placed on the outbound request. */
public enum CredentialMode {
    HEADER,
    QUERY
}
