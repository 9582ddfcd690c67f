package com.apfconfig.api;

import com.apfconfig.controller.ReconciliationHistory;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

@Path("/healthz")
@Produces(MediaType.TEXT_PLAIN)
public class HealthResource {

    @Inject
    ReconciliationHistory history;

    @GET
    public Response health() {
        return history.latest()
                .filter(report -> !report.succeeded())
                .map(report -> Response.status(Response.Status.SERVICE_UNAVAILABLE)
                        .entity("last reconciliation failed: " + report.error())
                        .build())
                .orElseGet(() -> Response.ok("ok").build());
    }
}
