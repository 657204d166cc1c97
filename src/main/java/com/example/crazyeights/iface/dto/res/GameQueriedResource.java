package com.example.crazyeights.iface.dto.res;

public record GameQueriedResource(String code, String message, GameStateView data) {

}
