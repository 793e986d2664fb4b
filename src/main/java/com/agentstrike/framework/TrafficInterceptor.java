package com.agentstrike.framework;

import burp.api.montoya.MontoyaApi;
import burp.api.montoya.http.message.HttpRequestResponse;
import burp.api.montoya.proxy.http.InterceptedResponse;
import burp.api.montoya.proxy.http.ProxyResponseHandler;
import burp.api.montoya.proxy.http.ProxyResponseReceivedAction;
import burp.api.montoya.proxy.http.ProxyResponseToBeSentAction;
import com.agentstrike.model.TrafficContext;
import com.agentstrike.scanner.PassiveAiScanner;
import com.agentstrike.scanner.PassiveDecision;

/**
 * Feeds proxied responses to the passive scanner. Only proxy traffic is observed,
 * so the active scanner's own probes (sent via api.http()) never re-enter triage.
 * Never modifies the traffic.
 */
public class TrafficInterceptor implements ProxyResponseHandler {

    private final MontoyaApi api;
    private final PassiveAiScanner passiveScanner;
    private final int maxBodySize;

    public TrafficInterceptor(MontoyaApi api, PassiveAiScanner passiveScanner, int maxBodySize) {
        this.api = api;
        this.passiveScanner = passiveScanner;
        this.maxBodySize = maxBodySize;
    }

    @Override
    public ProxyResponseReceivedAction handleResponseReceived(InterceptedResponse interceptedResponse) {
        if (!passiveScanner.isEnabled()) {
            return ProxyResponseReceivedAction.continueWith(interceptedResponse);
        }
        try {
            HttpRequestResponse reqResp = HttpRequestResponse.httpRequestResponse(
                    interceptedResponse.initiatingRequest(), interceptedResponse);
            TrafficContext context = TrafficContext.from(reqResp, maxBodySize).toBuilder()
                    .metadata("proxyMessageId", String.valueOf(interceptedResponse.messageId()))
                    .build();
            PassiveDecision decision = passiveScanner.onTraffic(context);
            if (decision == PassiveDecision.QUEUE_FULL) {
                api.logging().logToOutput("[Interceptor] Passive queue full, dropped " + context.getUrl());
            }
        } catch (NullPointerException e) {
            // Burp invalidates its API proxy during extension unload
            return ProxyResponseReceivedAction.continueWith(interceptedResponse);
        } catch (RuntimeException e) {
            api.logging().logToError("[Interceptor] ERROR: " + e.getClass().getName() + ": " + e.getMessage());
        }
        return ProxyResponseReceivedAction.continueWith(interceptedResponse);
    }

    @Override
    public ProxyResponseToBeSentAction handleResponseToBeSent(InterceptedResponse interceptedResponse) {
        return ProxyResponseToBeSentAction.continueWith(interceptedResponse);
    }
}
