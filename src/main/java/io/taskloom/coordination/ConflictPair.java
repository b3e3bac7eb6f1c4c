package io.taskloom.coordination;

public record ConflictPair(int itemA, int itemB, String reason) {
}
