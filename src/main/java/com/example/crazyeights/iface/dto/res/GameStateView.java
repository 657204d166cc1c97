package com.example.crazyeights.iface.dto.res;

public record GameStateView(boolean started, String topCard, String secondCard, Integer players,
		Integer currentPlayer, String direction, long version) {

}
