package org.deepsymmetry.bmj;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Stands in for the authoritative clock service, remembering every value pushed to it.
 */
class RecordingExternalClock implements ExternalClock {

    final List<String> calls = new ArrayList<>();
    Integer beats;
    Integer subdivisions;
    Set<Integer> gaps;
    Tempo tempo;
    Boolean emphasizeFirstBeat;
    Boolean sound;
    Boolean playing;

    @Override
    public void setBeats(int beats) {
        calls.add("beats");
        this.beats = beats;
    }

    @Override
    public void setSubdivisions(int subdivisions) {
        calls.add("subdivisions");
        this.subdivisions = subdivisions;
    }

    @Override
    public void setGaps(Set<Integer> gaps) {
        calls.add("gaps");
        this.gaps = gaps;
    }

    @Override
    public void setTempo(Tempo tempo) {
        calls.add("tempo");
        this.tempo = tempo;
    }

    @Override
    public void setEmphasizeFirstBeat(boolean emphasizeFirstBeat) {
        calls.add("emphasizeFirstBeat");
        this.emphasizeFirstBeat = emphasizeFirstBeat;
    }

    @Override
    public void setSound(boolean sound) {
        calls.add("sound");
        this.sound = sound;
    }

    @Override
    public void setPlaying(boolean playing) {
        calls.add("playing");
        this.playing = playing;
    }
}
