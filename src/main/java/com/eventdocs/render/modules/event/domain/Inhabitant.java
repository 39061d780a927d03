package com.eventdocs.render.modules.event.domain;

public record Inhabitant(Registration registration, boolean campingMat) {
}
