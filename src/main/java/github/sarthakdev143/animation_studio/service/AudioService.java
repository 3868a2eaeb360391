package github.sarthakdev143.animation_studio.service;

import github.sarthakdev143.animation_studio.model.AudioTrack;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

public interface AudioService {

    AudioTrack uploadAudio(String projectId, MultipartFile file) throws IOException;

    void removeAudio(String projectId) throws IOException;
}
