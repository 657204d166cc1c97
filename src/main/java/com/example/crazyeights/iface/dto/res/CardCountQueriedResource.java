package com.example.crazyeights.iface.dto.res;

public record CardCountQueriedResource(String code, String message, int gameId, int cardCount) {

}
