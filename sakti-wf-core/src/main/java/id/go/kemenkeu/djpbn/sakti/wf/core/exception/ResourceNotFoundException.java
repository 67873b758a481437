package id.go.kemenkeu.djpbn.sakti.wf.core.exception;

public class ResourceNotFoundException extends WorkflowException {

    public ResourceNotFoundException(String resourceType, Object resourceId) {
        super(ErrorKind.RESOURCE_NOT_FOUND,
            resourceType + " " + resourceId + " not found",
            "Data " + resourceType + " " + resourceId + " tidak ditemukan.");
    }
}
