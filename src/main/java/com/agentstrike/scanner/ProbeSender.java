package com.agentstrike.scanner;

import com.agentstrike.model.TrafficContext;

import java.io.IOException;

/**
 * Sends a modified request to the target and captures the response.
 */
public interface ProbeSender {

    /**
     * @param probe request to send; its response fields are ignored
     * @return the same request with status, response headers and body filled in
     */
    TrafficContext send(TrafficContext probe) throws IOException;
}
