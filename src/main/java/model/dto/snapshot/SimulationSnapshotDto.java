package model.dto.snapshot;

import lombok.Data;

import java.util.List;

/**
 * 仿真当前状态快照
 */
@Data
public class SimulationSnapshotDto {
    private String simulationId;
    private long simTime;
    private int pendingEventCount;
    private long processedEventCount;

    // 派单员分区 (ID 列表，保持分区内顺序)
    private List<String> waitingRiders;
    private List<String> cancelledRiders;
    private List<String> satisfiedRiders;
    private List<String> idleDrivers;
    private List<String> totalDrivers;

    // 实体详情
    private List<DriverSnapshotDto> drivers;
    private List<RiderSnapshotDto> riders;
}
