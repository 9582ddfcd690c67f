package com.apfconfig.api;

import com.apfconfig.controller.BootstrapConfigurationController;
import com.apfconfig.controller.ReconciliationHistory;
import com.apfconfig.model.ReconciliationReport;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.jboss.logging.Logger;

@Path("/bootstrap")
@Produces(MediaType.APPLICATION_JSON)
public class BootstrapResource {

    private static final Logger LOGGER = Logger.getLogger("API.BootstrapResource");

    @Inject
    BootstrapConfigurationController controller;

    @Inject
    ReconciliationHistory history;

    @GET
    @Path("/history")
    public List<ReconciliationReport> history() {
        return history.export();
    }

    @POST
    @Path("/reconcile")
    public Response reconcile() {
        ReconciliationReport report = controller.reconcile();
        if (!report.succeeded()) {
            LOGGER.warnv("[RECONCILE-API] id={0} failed: {1}", report.id(), report.error());
            return Response.serverError().entity(report).build();
        }
        return Response.ok(report).build();
    }
}
