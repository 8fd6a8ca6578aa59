package com.example.operatorrelay.model;

import java.io.Serializable;

/**
 * 运营者在线状态，进程内单例
 */
public class PresenceState implements Serializable {

    private static final long serialVersionUID = 1L;

    // 是否可用，默认离开
    private boolean available;

    // 待消费的状态切换提示
    private PresenceTransition pendingTransition = PresenceTransition.NONE;

    public PresenceState() {
    }

    public PresenceState(boolean available, PresenceTransition pendingTransition) {
        this.available = available;
        this.pendingTransition = pendingTransition;
    }

    public boolean isAvailable() {
        return available;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public PresenceTransition getPendingTransition() {
        return pendingTransition;
    }

    public void setPendingTransition(PresenceTransition pendingTransition) {
        this.pendingTransition = pendingTransition;
    }

    @Override
    public String toString() {
        return "PresenceState{" +
                "available=" + available +
                ", pendingTransition=" + pendingTransition +
                '}';
    }
}
