package br.edu.ifba.exception;

/**
 * Raised when data belonging to another tenant reaches the query pipeline.
 * Never recovered from: the request is aborted without partial results.
 */
public class TenantIsolationViolationException extends RuntimeException {

    private final String requestedTenant;
    private final String foundTenant;

    public TenantIsolationViolationException(String requestedTenant, String foundTenant, String location) {
        super("Row from tenant '" + foundTenant + "' returned to a request for tenant '"
                + requestedTenant + "' at " + location);
        this.requestedTenant = requestedTenant;
        this.foundTenant = foundTenant;
    }

    public String getRequestedTenant() {
        return requestedTenant;
    }

    public String getFoundTenant() {
        return foundTenant;
    }
}
