package com.example.logoswap.model;

public record PlacementCandidate(Anchor anchor, Rect rect, double score) {
}
