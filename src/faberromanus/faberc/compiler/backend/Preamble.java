package faberromanus.faberc.compiler.backend;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import faberromanus.faberc.compiler.Target;

/**
 * Renders the imports and helper definitions for the features recorded
 * while generating a program body.
 */
public class Preamble {

    private static final String RESOURCE_ROOT = "/faberromanus/faberc/preamble/";

    private Preamble() {}

    static String loadHelper(String path) {
        try(InputStream in = Preamble.class.getResourceAsStream(
            RESOURCE_ROOT + path
        )) {
            if(in == null) {
                throw new IllegalStateException(
                    "Missing preamble resource '" + path + "'"
                );
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch(IOException e) {
            throw new IllegalStateException(
                "Unable to read preamble resource '" + path + "'", e
            );
        }
    }

    public static String render(Target target, Features features) {
        switch(target) {
            case TYPESCRIPT: return Preamble.renderTypeScript(features);
            case PYTHON: return Preamble.renderPython(features);
            default: return "";
        }
    }

    private static String join(List<String> imports, List<String> helpers) {
        StringBuilder out = new StringBuilder();
        for(String line: imports) {
            out.append(line);
            out.append("\n");
        }
        for(String helper: helpers) {
            if(out.length() > 0) { out.append("\n"); }
            out.append(helper);
            if(!helper.endsWith("\n")) { out.append("\n"); }
        }
        if(out.length() > 0) { out.append("\n"); }
        return out.toString();
    }

    private static String renderTypeScript(Features features) {
        List<String> imports = new ArrayList<>();
        List<String> helpers = new ArrayList<>();
        if(features.contains(Feature.DECIMAL)) {
            imports.add("import Decimal from \"decimal.js\";");
        }
        boolean flumina = features.contains(Feature.FLUMINA);
        boolean fluminaAsync = features.contains(Feature.FLUMINA_ASYNC);
        if(flumina || fluminaAsync) {
            helpers.add(Preamble.loadHelper("ts/responsum.ts"));
        }
        if(flumina) {
            helpers.add(Preamble.loadHelper("ts/flumina.ts"));
        }
        if(fluminaAsync) {
            helpers.add(Preamble.loadHelper("ts/flumina_async.ts"));
        }
        if(features.contains(Feature.PANIC)) {
            helpers.add(Preamble.loadHelper("ts/panic.ts"));
        }
        return Preamble.join(imports, helpers);
    }

    private static String renderPython(Features features) {
        List<String> imports = new ArrayList<>();
        List<String> typing = new ArrayList<>();
        for(Feature feature: Feature.values()) {
            if(!features.contains(feature)) { continue; }
            switch(feature) {
                case SYS: imports.add("import sys"); break;
                case WARNINGS: imports.add("import warnings"); break;
                case ASYNCIO: imports.add("import asyncio"); break;
                case FUNCTOOLS: imports.add("import functools"); break;
                case ITERTOOLS: imports.add("import itertools"); break;
                case RANDOM: imports.add("import random"); break;
                case MATH: imports.add("import math"); break;
                case COLLECTIONS: imports.add("import collections"); break;
                case RE: imports.add("import re"); break;
                case DECIMAL:
                    imports.add("from decimal import Decimal");
                    break;
                case ENUM: imports.add("from enum import Enum"); break;
                case DATACLASS:
                    imports.add("from dataclasses import dataclass");
                    break;
                case SIMPLE_NAMESPACE:
                    imports.add("from types import SimpleNamespace");
                    break;
                case TYPING_ANY: typing.add("Any"); break;
                case TYPING_CALLABLE: typing.add("Callable"); break;
                case TYPING_ITERATOR: typing.add("Iterator"); break;
                case TYPING_ASYNC_ITERATOR: typing.add("AsyncIterator"); break;
                case TYPING_TYPEVAR: typing.add("TypeVar"); break;
                case TYPING_PROTOCOL: typing.add("Protocol"); break;
                default: break;
            }
        }
        if(typing.size() > 0) {
            imports.add("from typing import " + String.join(", ", typing));
        }
        if(features.contains(Feature.PYTEST)) {
            imports.add("import pytest");
        }
        List<String> helpers = new ArrayList<>();
        boolean flumina = features.contains(Feature.FLUMINA);
        boolean fluminaAsync = features.contains(Feature.FLUMINA_ASYNC);
        if(flumina || fluminaAsync) {
            helpers.add(Preamble.loadHelper("py/responsum.py"));
        }
        if(flumina) {
            helpers.add(Preamble.loadHelper("py/flumina.py"));
        }
        if(fluminaAsync) {
            helpers.add(Preamble.loadHelper("py/flumina_async.py"));
        }
        if(features.contains(Feature.PANIC)) {
            helpers.add(Preamble.loadHelper("py/panic.py"));
        }
        if(features.contains(Feature.PRAEFIXUM)) {
            helpers.add(Preamble.loadHelper("py/praefixum.py"));
        }
        return Preamble.join(imports, helpers);
    }

}
