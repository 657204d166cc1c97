package com.example.crazyeights.iface.dto.res;

public record GameErrorResource(String code, String message) {

}
