package com.ciro.jlive.template;

import com.ciro.jlive.rendered.Rendered;

import java.util.Map;

/** Lo que se recuerda de un componente entre renders. */
public record MountedComponent(MountKey key, Map<String, Object> assigns, Rendered rendered) {}
