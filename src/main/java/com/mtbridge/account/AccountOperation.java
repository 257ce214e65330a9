package com.mtbridge.account;

import java.util.Map;

/**
 * One named operation an account object publishes. Arguments are passed by name;
 * an operation ignores names it does not use.
 */
@FunctionalInterface
public interface AccountOperation {

    Object invoke(Map<String, Object> arguments) throws Exception;
}
