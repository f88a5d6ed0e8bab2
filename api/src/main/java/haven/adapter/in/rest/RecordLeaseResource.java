package haven.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import haven.adapter.in.auth.BearerTokenResolver;
import haven.adapter.in.dto.LeaseResponse;
import haven.adapter.in.dto.LeaseStatusResponse;
import haven.adapter.in.problem.SecurityProblem;
import haven.core.model.auth.Permission;
import haven.core.model.auth.TokenClaims;
import haven.core.model.lease.LeaseTarget;
import haven.core.port.in.LeaseManagement;

/**
 * REST resource for CRM record edit locks.
 *
 * <p>The optional {@code section} query parameter narrows the lock to one
 * section of the record. Locks on different sections are independent.
 */
@Path("/crm/records/{recordId}/lock")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class RecordLeaseResource {

    private final LeaseManagement leaseManagement;
    private final BearerTokenResolver bearerTokenResolver;

    @Inject
    public RecordLeaseResource(LeaseManagement leaseManagement, BearerTokenResolver bearerTokenResolver) {
        this.leaseManagement = leaseManagement;
        this.bearerTokenResolver = bearerTokenResolver;
    }

    /**
     * Acquire the lock.
     *
     * @return 200 with the lease, 409 if someone else holds it
     */
    @POST
    public Uni<LeaseResponse> acquire(
            @PathParam("recordId") String recordId,
            @QueryParam("section") String section,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        final var target = target(recordId, section);
        return editor(authorization)
                .flatMap(claims -> leaseManagement.acquire(target, claims.subject()))
                .map(LeaseResponse::fromModel);
    }

    /**
     * Extend a held lock.
     *
     * @return 200 with the renewed lease
     */
    @PUT
    public Uni<LeaseResponse> renew(
            @PathParam("recordId") String recordId,
            @QueryParam("section") String section,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        final var target = target(recordId, section);
        return editor(authorization)
                .flatMap(claims -> leaseManagement.renew(target, claims.subject()))
                .map(LeaseResponse::fromModel);
    }

    /**
     * Release a held lock.
     *
     * @return 204 No Content, also when there was no lock
     */
    @DELETE
    public Uni<Response> release(
            @PathParam("recordId") String recordId,
            @QueryParam("section") String section,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        final var target = target(recordId, section);
        return editor(authorization)
                .flatMap(claims -> leaseManagement.release(target, claims.subject()))
                .map(v -> Response.noContent().build());
    }

    /**
     * Report who, if anyone, holds the lock.
     */
    @GET
    public Uni<LeaseStatusResponse> status(
            @PathParam("recordId") String recordId,
            @QueryParam("section") String section,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        final var target = target(recordId, section);
        return bearerTokenResolver
                .resolve(authorization)
                .flatMap(claims -> leaseManagement.status(target))
                .map(LeaseStatusResponse::fromModel);
    }

    private Uni<TokenClaims> editor(String authorization) {
        return bearerTokenResolver.resolve(authorization).invoke(claims -> {
            if (!Permission.isGranted(claims, Permission.CRM_WRITE)) {
                throw SecurityProblem.forbidden("Permission required: " + Permission.CRM_WRITE);
            }
        });
    }

    private static LeaseTarget target(String recordId, String section) {
        try {
            return new LeaseTarget(recordId, section);
        } catch (IllegalArgumentException e) {
            throw SecurityProblem.badRequest(e.getMessage());
        }
    }
}
