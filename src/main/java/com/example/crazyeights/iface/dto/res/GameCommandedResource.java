package com.example.crazyeights.iface.dto.res;

import java.util.List;

/**
 * 指令受理結果：新的 Stream 版本與可讀的事件描述
 */
public record GameCommandedResource(String code, String message, int gameId, long version, List<String> events) {

}
