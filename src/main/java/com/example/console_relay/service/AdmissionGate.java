package com.example.console_relay.service;

import com.example.console_relay.dto.OperatorIdentity;
import com.example.console_relay.dto.ResourceDescriptor;

/**
 * Decides whether an operator may open a console on a resource. Runs before any ticket
 * is minted and again before any upstream connection is attempted.
 */
public interface AdmissionGate {

    /**
     * @throws com.example.console_relay.exception.ConsoleRelayException with
     *         {@code UNAUTHORIZED} when the operator is denied
     */
    void admit(OperatorIdentity operator, ResourceDescriptor resource);
}
