package model.dto.snapshot;

import lombok.Data;
import model.entity.Location;

@Data
public class DriverSnapshotDto {
    private String identifier;
    private Location location;
    private Location destination;
    private int speed;
    private boolean idle;
    private boolean inIdlePool; // 是否在派单员的空闲列表中
}
