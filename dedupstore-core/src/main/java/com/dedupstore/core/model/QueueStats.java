package com.dedupstore.core.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class QueueStats {
    private long queued;
    private long processing;
    private long completed;
    private long failed;
}
