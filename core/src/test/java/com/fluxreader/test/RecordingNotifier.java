package com.fluxreader.test;

import com.fluxreader.api.Notifier;

import java.util.ArrayList;
import java.util.List;

public class RecordingNotifier implements Notifier {
    public final List<String> infos = new ArrayList<>();
    public final List<String> errors = new ArrayList<>();

    @Override
    public void info(String message) {
        infos.add(message);
    }

    @Override
    public void error(String message) {
        errors.add(message);
    }

    public String lastInfo() {
        return infos.isEmpty() ? null : infos.get(infos.size() - 1);
    }
}
