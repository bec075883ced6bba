package model.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 仿真统计报告
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SimulationReport {

    /**
     * 乘客平均等待时间：叫车到首次上车或取消
     */
    @JsonProperty("rider_wait_time")
    private double riderWaitTime;

    /**
     * 司机平均总行驶距离
     */
    @JsonProperty("driver_total_distance")
    private double driverTotalDistance;

    /**
     * 司机平均载客距离（按全部司机平均）
     */
    @JsonProperty("driver_ride_distance")
    private double driverRideDistance;
}
