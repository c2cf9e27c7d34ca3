package org.pilot.usertransactions.dto;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
public class UpdateStatusRequest {
    private String status;

    @Getter(AccessLevel.NONE)
    private boolean statusPresent;

    public UpdateStatusRequest(String status) {
        if (status != null) setStatus(status);
    }

    public void setStatus(String status) {
        this.status = status;
        this.statusPresent = true;
    }

    public boolean hasStatus() {
        return statusPresent;
    }
}
