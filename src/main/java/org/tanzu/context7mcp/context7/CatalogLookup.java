package org.tanzu.context7mcp.context7;

/**
 * Outcome of a single catalog lookup.
 * 
 * Not-found and upstream failures are values, not exceptions, so each caller
 * applies its own policy: single-item tools raise, the multi-library search
 * fails the whole batch, the multi-library fetch substitutes a placeholder.
 * 
 * @param <T> type of the found value
 */
public final class CatalogLookup<T> {

    public enum Status { FOUND, NOT_FOUND, UPSTREAM_ERROR }

    private final Status status;
    private final T value;
    private final String detail;

    private CatalogLookup(Status status, T value, String detail) {
        this.status = status;
        this.value = value;
        this.detail = detail;
    }

    public static <T> CatalogLookup<T> found(T value) {
        return new CatalogLookup<>(Status.FOUND, value, null);
    }

    public static <T> CatalogLookup<T> notFound(String detail) {
        return new CatalogLookup<>(Status.NOT_FOUND, null, detail);
    }

    public static <T> CatalogLookup<T> upstreamError(String detail) {
        return new CatalogLookup<>(Status.UPSTREAM_ERROR, null, detail);
    }

    public Status getStatus() { return status; }
    public boolean isFound() { return status == Status.FOUND; }

    /** The found value; null unless {@link #isFound()}. */
    public T getValue() { return value; }

    /** Why nothing was found; null when found. */
    public String getDetail() { return detail; }

    @Override
    public String toString() {
        return "CatalogLookup{status=" + status + (detail != null ? ", detail='" + detail + "'" : "") + "}";
    }
}
