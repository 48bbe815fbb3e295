package villagecompute.messagegateway.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.messagegateway.api.types.ToolResultType;
import villagecompute.messagegateway.exceptions.ErrorKind;
import villagecompute.messagegateway.observability.LoggingConfig;
import villagecompute.messagegateway.services.ToolDispatcher;
import villagecompute.messagegateway.services.ToolName;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * HTTP entry point of the tool surface.
 *
 * <p>
 * Tool failures are reported inside the {@link ToolResultType} envelope with status 200; only an unknown tool name
 * yields 404.
 */
@Path("/api/tools")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(
        name = "Tools",
        description = "Scheduling, batch and gradual export tools")
public class ToolResource {

    private static final Logger LOG = Logger.getLogger(ToolResource.class);

    @Inject
    ToolDispatcher dispatcher;

    @GET
    @Operation(
            summary = "List tools",
            description = "Names and descriptions of every tool the gateway exposes")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Tool catalog",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ToolDescription.class)))})
    public List<ToolDescription> listTools() {
        return Arrays.stream(ToolName.values()).map(tool -> new ToolDescription(tool.wireName(), tool.getDescription()))
                .toList();
    }

    /**
     * Invokes a tool.
     *
     * @param name
     *            wire name of the tool, e.g. {@code schedule_message}
     * @param arguments
     *            JSON object of tool arguments
     * @param origin
     *            optional caller label recorded in the logs
     */
    @POST
    @Path("/{name}")
    @Operation(
            summary = "Call a tool",
            description = "Runs the named tool with the given JSON arguments")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Tool ran; see success and error_kind",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ToolResultType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Unknown tool",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ToolResultType.class)))})
    public CompletionStage<Response> callTool(@PathParam("name") String name, JsonNode arguments,
            @HeaderParam("X-Request-Origin") String origin) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin(origin);
        LOG.debugf("Tool call %s from %s", name, origin);
        try {
            return dispatcher.dispatch(name, arguments).thenApply(result -> {
                Response.Status status = ErrorKind.UNKNOWN_TOOL.wireName().equals(result.errorKind())
                        ? Response.Status.NOT_FOUND
                        : Response.Status.OK;
                return Response.status(status).entity(result).build();
            });
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    public record ToolDescription(String name, String description) {
    }
}
