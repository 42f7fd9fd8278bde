package app.signaltrust.keys.secret;

import java.util.Optional;

public record KeyResolution(
        String name,
        String value,
        ResolutionSource source,
        String warning
) {

    public Optional<String> valueOptional() {
        return Optional.ofNullable(value);
    }

    public boolean found() {
        return source != ResolutionSource.NONE;
    }

    public boolean hasWarning() {
        return warning != null;
    }

    @Override
    public String toString() {
        return "KeyResolution[name=" + name + ", source=" + source + ", warning=" + warning + "]";
    }
}
