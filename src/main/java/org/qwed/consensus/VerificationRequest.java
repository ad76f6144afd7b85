package org.qwed.consensus;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.qwed.core.Artifact;
import org.qwed.core.VerificationMode;

import java.util.Objects;

@Getter
@EqualsAndHashCode
public final class VerificationRequest {

    private final Artifact artifact;
    private final VerificationMode mode;

    public VerificationRequest(Artifact artifact, VerificationMode mode) {
        this.artifact = Objects.requireNonNull(artifact, "artifact cannot be null");
        this.mode = Objects.requireNonNull(mode, "mode cannot be null");
    }

    @Override
    public String toString() {
        return "VerificationRequest(" + artifact + ", " + mode + ")";
    }
}
