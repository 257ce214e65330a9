package com.mtbridge.connect;

import com.mtbridge.config.GatewayConfig;
import com.mtbridge.rpc.RpcRequest;

/**
 * Field-name aliases that request types across deployments use for the same values.
 * Every alias a request type declares is written; the rest are skipped.
 */
final class CredentialFields {

    static final String[] LOGIN = {"login", "user", "account", "login_id"};
    static final String[] PASSWORD = {"password", "pwd", "pass"};
    static final String[] SERVER = {"server", "server_name"};
    static final String[] IDENTITY = {"terminalInstanceGuid", "terminal_instance_guid", "id"};

    private CredentialFields() {}

    /** Writes login, password, server and identity into whichever aliases {@code request} declares. */
    static void fill(RpcRequest request, GatewayConfig config, String identity) {
        request.setAll(config.getLogin(), LOGIN);
        request.setAll(config.getPassword(), PASSWORD);
        request.setAll(config.getServerName(), SERVER);
        request.setAll(identity, IDENTITY);
    }
}
