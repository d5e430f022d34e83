package com.basketgov.policy;

/**
 * External validator agent that scores a set of operations. Implementations
 * may block; callers go through {@link ValidatorGateway}, which bounds the
 * wait.
 */
public interface ValidatorClient {

    ValidatorReport validate(ValidationRequest request) throws Exception;
}
