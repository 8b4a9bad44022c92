package com.opspos.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReplayQueueStats {

    private long pending;
    private long syncing;
    private long failed;

    public long getTotal() {
        return pending + syncing + failed;
    }
}
