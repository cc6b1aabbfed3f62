package demo;

/**
 * Raised by the mock platform clients when a call cannot be served.
 */
public class PlatformApiException extends Exception {

    private final String apiName;

    public PlatformApiException(String apiName, String message) {
        super(message);
        this.apiName = apiName;
    }

    public String getApiName() {
        return apiName;
    }
}
