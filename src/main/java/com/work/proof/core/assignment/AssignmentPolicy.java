package com.work.proof.core.assignment;

import com.work.proof.core.model.ProvingNetwork;

/**
 * 按请求计数器做确定性轮转：
 * counter % 4 == 0 -> FERMAH，== 1 -> LAGRANGE，其余 -> 当前偏好网络（默认 NONE）。
 * <p>
 * 纯函数，不修改任何状态；选中的网络若为 NONE 或处于 INACTIVE，由调用方直接拒绝。
 */
public final class AssignmentPolicy {

    private AssignmentPolicy() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static ProvingNetwork assign(long requestCounter, ProvingNetwork preferred) {
        long slot = Math.floorMod(requestCounter, 4L);
        if (slot == 0) {
            return ProvingNetwork.FERMAH;
        }
        if (slot == 1) {
            return ProvingNetwork.LAGRANGE;
        }
        return preferred == null ? ProvingNetwork.NONE : preferred;
    }
}
