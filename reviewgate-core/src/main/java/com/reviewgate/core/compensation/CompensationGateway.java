package com.reviewgate.core.compensation;

import com.reviewgate.core.exception.CompensationException;

/**
 * External system receiving compensation actions (ticketing, notifications).
 */
@FunctionalInterface
public interface CompensationGateway {

    /**
     * Issue a compensation action.
     *
     * @param request The action to issue
     * @throws CompensationException if the action could not be issued
     */
    void execute(CompensationRequest request) throws CompensationException;
}
