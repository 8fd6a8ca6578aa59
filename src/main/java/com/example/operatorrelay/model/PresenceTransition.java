package com.example.operatorrelay.model;

/**
 * 运营者状态切换后待展示的一次性提示
 */
public enum PresenceTransition {
    NONE,
    BECAME_AVAILABLE,
    BECAME_AWAY
}
