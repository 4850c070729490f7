package dev.jobmatcher.web;

import dev.jobmatcher.model.CandidateProfile;
import dev.jobmatcher.profile.ProfileExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ProfileController {

    private final ProfileExtractor profileExtractor;

    public record ResumeTextRequest(String resumeText) {
    }

    @PostMapping("/profile")
    public Mono<CandidateProfile> extractProfile(@RequestBody ResumeTextRequest request) {
        return profileExtractor.extract(request.resumeText());
    }
}
