package com.example.memeswap.face;

/** Head pose in degrees. */
public record Orientation(double pitch, double yaw, double roll) {
}
