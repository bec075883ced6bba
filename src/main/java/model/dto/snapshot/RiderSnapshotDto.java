package model.dto.snapshot;

import common.consts.RiderStatusEnum;
import lombok.Data;
import model.entity.Location;

@Data
public class RiderSnapshotDto {
    private String identifier;
    private Location origin;
    private Location destination;
    private long patience;
    private RiderStatusEnum status;
}
