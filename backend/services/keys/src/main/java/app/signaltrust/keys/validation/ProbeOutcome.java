package app.signaltrust.keys.validation;

public record ProbeOutcome(
        boolean accepted,
        boolean retryable,
        String error
) {

    public static ProbeOutcome ok() {
        return new ProbeOutcome(true, false, null);
    }

    public static ProbeOutcome rejected(String error) {
        return new ProbeOutcome(false, false, error);
    }

    public static ProbeOutcome retryable(String error) {
        return new ProbeOutcome(false, true, error);
    }

    public static ProbeOutcome fromStatus(int status) {
        if (status >= 200 && status < 300) {
            return ok();
        }
        if (status == 401) {
            return rejected("Invalid API key (401 Unauthorized)");
        }
        if (status == 403) {
            return rejected("Access forbidden (403)");
        }
        if (status == 429) {
            return retryable("Rate limit exceeded (429)");
        }
        if (status >= 500) {
            return retryable("Provider error (" + status + ")");
        }
        return rejected("Unexpected response (" + status + ")");
    }
}
