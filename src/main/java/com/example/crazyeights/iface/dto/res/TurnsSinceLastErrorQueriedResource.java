package com.example.crazyeights.iface.dto.res;

import java.util.Map;

/**
 * @param turns 玩家編號 → 距上次犯規的回合數
 */
public record TurnsSinceLastErrorQueriedResource(String code, String message, int gameId, Map<Integer, Integer> turns) {

}
